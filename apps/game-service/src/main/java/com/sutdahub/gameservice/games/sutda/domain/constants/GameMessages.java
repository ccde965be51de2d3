package com.sutdahub.gameservice.games.sutda.domain.constants;

/**
 * 花斗相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 牌 / 牌型 ==========

    /** 非法牌编号 */
    public static final String INVALID_CARD = "非法的牌编号: %d（应为 1~20）";

    public static final String DUPLICATE_CARD = "同一张牌不能重复出现";

    public static final String HAND_SIZE_INVALID = "手牌张数不正确";

    public static final String DECK_EXHAUSTED = "牌堆剩余牌数不足";

    public static String formatInvalidCard(int id) {
        return String.format(INVALID_CARD, id);
    }

    // ========== 对局 / 玩家 ==========

    public static final String GAME_NOT_FOUND = "对局不存在";

    public static final String GAME_EXISTS = "对局已存在";

    public static final String PLAYER_EXISTS = "玩家已在对局中";

    public static final String PLAYER_NOT_FOUND = "玩家不在该对局中";

    public static final String GAME_FULL = "座位已满（最多 %d 人）";

    public static final String JOIN_NOT_ALLOWED = "对局进行中，暂不能加入";

    public static final String START_NOT_ALLOWED = "当前状态不能开局";

    public static final String NOT_ENOUGH_PLAYERS = "至少需要两名余额大于 0 的玩家";

    public static final String NAME_REQUIRED = "玩家名称不能为空";

    public static final String BASE_BET_INVALID = "底注必须大于 0";

    public static String formatGameFull(int capacity) {
        return String.format(GAME_FULL, capacity);
    }

    // ========== 回合 ==========

    public static final String GAME_NOT_PLAYING = "当前对局不在下注阶段";

    public static final String NOT_YOUR_TURN = "未轮到你行动（当前应为 %s）";

    public static final String TURN_EXPIRED = "本回合已超时";

    public static final String ALREADY_FOLDED = "你已弃牌，本局不能再行动";

    public static final String NOT_IN_ROUND = "你未参与本局";

    public static String formatNotYourTurn(String current) {
        return String.format(NOT_YOUR_TURN, current);
    }

    // ========== 下注 ==========

    public static final String ACTION_REQUIRED = "缺少行动类型";

    public static final String NOT_A_PLAYER_ACTION = "不支持的行动类型: %s";

    public static final String CHECK_NOT_ALLOWED = "有未跟的注，不能过牌";

    public static final String NOTHING_TO_CALL = "无需跟注，请选择过牌";

    public static final String AMOUNT_REQUIRED = "下注 / 加注必须给出金额";

    public static final String BET_BELOW_MINIMUM = "下注金额不得低于 %d";

    public static final String BET_NOT_ABOVE_HIGHEST = "加注后必须超过当前最高注 %d";

    public static final String BET_BELOW_CALL = "该下注不足以跟上当前最高注 %d";

    public static final String INSUFFICIENT_FUNDS = "余额不足：需要 %d，当前 %d";

    public static String formatNotAPlayerAction(Object type) {
        return String.format(NOT_A_PLAYER_ACTION, type);
    }

    public static String formatBelowMinimum(long min) {
        return String.format(BET_BELOW_MINIMUM, min);
    }

    public static String formatNotAboveHighest(long highest) {
        return String.format(BET_NOT_ABOVE_HIGHEST, highest);
    }

    public static String formatBelowCall(long highest) {
        return String.format(BET_BELOW_CALL, highest);
    }

    public static String formatInsufficient(long need, long balance) {
        return String.format(INSUFFICIENT_FUNDS, need, balance);
    }

    // ========== 三张模式选牌 ==========

    public static final String SELECT_NOT_ALLOWED = "只有三张模式的下注阶段可以选牌";

    public static final String SELECT_NOT_OWNED = "只能从自己的手牌中选择两张";

    // ========== 并发 ==========

    public static final String VERSION_CONFLICT = "对局状态已变化（期望版本 %d，实际 %d），请刷新后重试";

    public static final String PLAYER_VERSION_CONFLICT = "玩家状态已变化，请刷新后重试";

    public static String formatVersionConflict(long expected, long actual) {
        return String.format(VERSION_CONFLICT, expected, actual);
    }
}
