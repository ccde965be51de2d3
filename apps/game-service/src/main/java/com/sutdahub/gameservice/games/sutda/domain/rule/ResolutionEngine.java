package com.sutdahub.gameservice.games.sutda.domain.rule;

import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;
import com.sutdahub.gameservice.games.sutda.domain.hand.HandEvaluator;
import com.sutdahub.gameservice.games.sutda.domain.hand.HandRank;
import com.sutdahub.gameservice.games.sutda.domain.hand.HandValue;
import com.sutdahub.gameservice.games.sutda.domain.hand.Outcome;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionRecord;
import com.sutdahub.gameservice.games.sutda.domain.model.ActionType;
import com.sutdahub.gameservice.games.sutda.domain.model.GameState;
import com.sutdahub.gameservice.games.sutda.domain.model.GameStatus;
import com.sutdahub.gameservice.games.sutda.domain.model.GameTable;
import com.sutdahub.gameservice.games.sutda.domain.model.PlayerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 结算引擎：本轮下注结束后决定赢家或流局，并计算奖励。
 * <ol>
 *   <li>只剩一人未弃牌：直接拿走底池，不亮牌；</li>
 *   <li>有구사类牌：最佳非 VOID 牌分值不超过对应门槛（或没有非 VOID 牌）则流局；</li>
 *   <li>否则 VOID 牌出局，其余比牌，同分座位小者胜；</li>
 *   <li>按奖励表向输家追加扣款。</li>
 * </ol>
 */
@Slf4j
public class ResolutionEngine {

    /** 구사：알리及以下流局 */
    public static final int GUSA_THRESHOLD = HandRank.ALI.score();
    /** 멍텅구리구사：장땡及以下流局 */
    public static final int MEONGTEONGGURI_THRESHOLD = HandRank.TTAENG_10.score();

    private final HandEvaluator evaluator;
    private final BonusTable bonusTable;
    private final Duration regameDelay;

    public ResolutionEngine(HandEvaluator evaluator, BonusTable bonusTable, Duration regameDelay) {
        this.evaluator = evaluator;
        this.bonusTable = bonusTable;
        this.regameDelay = regameDelay;
    }

    /**
     * 玩家亮出的牌值：三张模式已选两张则用所选，否则取最优两张。
     */
    public HandValue handOf(PlayerState p) {
        if (p.getSelected() != null && p.getSelected().size() == 2) {
            return evaluator.evaluate(p.getSelected());
        }
        return evaluator.bestValue(p.getCards());
    }

    public RoundResult resolve(GameTable table, long now) {
        List<PlayerState> contenders = TurnOrder.contenders(table.players());
        if (contenders.isEmpty()) {
            throw new GameStateException(GameMessages.GAME_NOT_PLAYING);
        }
        if (contenders.size() == 1) {
            return settle(table, contenders.get(0), Map.of(), null, RoundResult.Kind.FOLD_WIN, now);
        }

        Map<String, HandValue> hands = new LinkedHashMap<>();
        for (PlayerState p : contenders) {
            hands.put(p.getPlayerId(), handOf(p));
        }
        boolean gusa = hands.values().stream().anyMatch(h -> h.rank() == HandRank.GUSA);
        boolean meong = hands.values().stream().anyMatch(h -> h.rank() == HandRank.MEONGTEONGGURI_GUSA);
        List<PlayerState> live = contenders.stream().filter(p -> !hands.get(p.getPlayerId()).isVoid()).toList();

        if (gusa || meong) {
            int best = live.stream().mapToInt(p -> hands.get(p.getPlayerId()).score()).max().orElse(-1);
            boolean regame = live.isEmpty()
                    || (gusa && best <= GUSA_THRESHOLD)
                    || (meong && best <= MEONGTEONGGURI_THRESHOLD);
            if (regame) {
                return regame(table, gusa, meong, now);
            }
        }

        PlayerState winner = pickWinner(live, hands);
        HandRank winRank = hands.get(winner.getPlayerId()).rank();
        long baseBet = table.game().getBaseBet();
        Map<String, Long> ledger = new LinkedHashMap<>();
        for (PlayerState loser : live) {
            if (loser.getPlayerId().equals(winner.getPlayerId())) {
                continue;
            }
            long bonus = bonusTable.bonus(winRank, hands.get(loser.getPlayerId()).rank(), baseBet);
            long debited = Math.min(bonus, loser.getBalance());
            if (debited > 0) {
                ledger.put(loser.getPlayerId(), debited);
            }
        }
        return settle(table, winner, ledger, winRank, RoundResult.Kind.SHOWDOWN, now);
    }

    /**
     * 擂台式比牌：按分值从高到低（同分座位小者在前）排列，
     * 挑战者只有在 compare 结果为胜时才取代当前擂主，平局保留先到者。
     * 克制牌（땡잡이、암행어사）因此能抓住场上最强的那手牌。
     */
    private PlayerState pickWinner(List<PlayerState> live, Map<String, HandValue> hands) {
        List<PlayerState> ordered = new ArrayList<>(live);
        ordered.sort(Comparator
                .comparingInt((PlayerState p) -> hands.get(p.getPlayerId()).score()).reversed()
                .thenComparingInt(PlayerState::getSeat));
        PlayerState champion = ordered.get(0);
        for (int i = 1; i < ordered.size(); i++) {
            PlayerState challenger = ordered.get(i);
            Outcome o = evaluator.compare(hands.get(challenger.getPlayerId()), hands.get(champion.getPlayerId()));
            if (o == Outcome.A_WINS) {
                champion = challenger;
            }
        }
        return champion;
    }

    private RoundResult settle(GameTable table, PlayerState winner, Map<String, Long> ledger,
                               HandRank winRank, RoundResult.Kind kind, long now) {
        GameState g = table.game();
        long bonusTotal = ledger.values().stream().mapToLong(Long::longValue).sum();
        long payout = g.getPot() + bonusTotal;

        List<PlayerState> players = new ArrayList<>();
        for (PlayerState p : table.players()) {
            if (p.getPlayerId().equals(winner.getPlayerId())) {
                players.add(p.toBuilder().balance(p.getBalance() + payout).build());
            } else if (ledger.containsKey(p.getPlayerId())) {
                players.add(p.toBuilder().balance(p.getBalance() - ledger.get(p.getPlayerId())).build());
            } else {
                players.add(p);
            }
        }
        boolean reveal = kind == RoundResult.Kind.SHOWDOWN;
        GameState next = g.toBuilder()
                .status(GameStatus.FINISHED)
                .currentPlayerId(null)
                .turnDeadline(null)
                .winnerId(winner.getPlayerId())
                .lastWinnerId(winner.getPlayerId())
                .payout(payout)
                .bonusLedger(Map.copyOf(ledger))
                .revealCards(reveal)
                .winningRank(winRank == null ? null : winRank.name())
                .updatedAt(now)
                .build();
        ActionRecord record = ActionRecord.builder()
                .gameId(g.getGameId())
                .round(g.getRound())
                .type(ActionType.SETTLE)
                .playerId(winner.getPlayerId())
                .amount(payout)
                .note(winRank == null ? kind.name() : winRank.name())
                .at(now)
                .build();
        log.info("本局结算: game={}, kind={}, winner={}, rank={}, pot={}, bonus={}",
                g.getGameId(), kind, winner.getPlayerId(), winRank, g.getPot(), ledger);
        return new RoundResult(kind, new GameTable(next, players), winner.getPlayerId(), payout, Map.copyOf(ledger), record);
    }

    private RoundResult regame(GameTable table, boolean gusa, boolean meong, long now) {
        GameState g = table.game();
        List<PlayerState> players = table.players().stream()
                .map(p -> p.isInRound()
                        ? p.toBuilder().cards(List.of()).selected(List.of()).folded(false).acted(false).roundBet(0).build()
                        : p)
                .toList();
        GameState next = g.toBuilder()
                .status(GameStatus.REGAME)
                .carryOver(g.getPot())
                .lastBet(0)
                .currentPlayerId(null)
                .turnDeadline(null)
                .winnerId(null)
                .regameAt(now + regameDelay.toMillis())
                .updatedAt(now)
                .build();
        String cause = meong ? HandRank.MEONGTEONGGURI_GUSA.name() : HandRank.GUSA.name();
        if (gusa && meong) {
            cause = HandRank.MEONGTEONGGURI_GUSA.name() + "," + HandRank.GUSA.name();
        }
        ActionRecord record = ActionRecord.builder()
                .gameId(g.getGameId())
                .round(g.getRound())
                .type(ActionType.REGAME)
                .amount(g.getPot())
                .note(cause)
                .at(now)
                .build();
        log.info("流局: game={}, cause={}, pot={}, regameAt={}", g.getGameId(), cause, g.getPot(), next.getRegameAt());
        return new RoundResult(RoundResult.Kind.REGAME, new GameTable(next, players), null, 0L, Map.of(), record);
    }
}
