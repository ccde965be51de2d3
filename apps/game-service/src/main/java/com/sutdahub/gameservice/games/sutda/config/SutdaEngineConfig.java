package com.sutdahub.gameservice.games.sutda.config;

import com.sutdahub.gameservice.games.sutda.domain.card.DeckFactory;
import com.sutdahub.gameservice.games.sutda.domain.card.ShuffledDeckFactory;
import com.sutdahub.gameservice.games.sutda.domain.hand.HandEvaluator;
import com.sutdahub.gameservice.games.sutda.domain.rule.BettingStateMachine;
import com.sutdahub.gameservice.games.sutda.domain.rule.BonusTable;
import com.sutdahub.gameservice.games.sutda.domain.rule.ResolutionEngine;
import com.sutdahub.gameservice.games.sutda.domain.rule.RoundDealer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;

/**
 * 花斗引擎装配：规则对象本身不依赖 Spring，这里统一按配置构造。
 */
@Configuration
public class SutdaEngineConfig {

    @Value("${sutda.turn.seconds:30}")
    private int turnSeconds;

    @Value("${sutda.regame.delay-seconds:5}")
    private int regameDelaySeconds;

    @Bean
    public Clock sutdaClock() {
        return Clock.systemUTC();
    }

    @Bean
    public HandEvaluator handEvaluator() {
        return new HandEvaluator();
    }

    @Bean
    public DeckFactory deckFactory() {
        return new ShuffledDeckFactory(new SecureRandom());
    }

    @Bean
    public BettingStateMachine bettingStateMachine() {
        return new BettingStateMachine(Duration.ofSeconds(turnSeconds));
    }

    @Bean
    public RoundDealer roundDealer(DeckFactory deckFactory) {
        return new RoundDealer(deckFactory, Duration.ofSeconds(turnSeconds));
    }

    @Bean
    public ResolutionEngine resolutionEngine(HandEvaluator handEvaluator) {
        return new ResolutionEngine(handEvaluator, BonusTable.standard(), Duration.ofSeconds(regameDelaySeconds));
    }
}
