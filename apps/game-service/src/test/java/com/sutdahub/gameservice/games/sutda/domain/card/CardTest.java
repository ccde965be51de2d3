package com.sutdahub.gameservice.games.sutda.domain.card;

import com.sutdahub.gameservice.common.error.GameStateException;
import com.sutdahub.gameservice.common.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardTest {

    @Test
    void monthIsCeilingOfHalfId() {
        assertThat(Card.of(1).month()).isEqualTo(1);
        assertThat(Card.of(2).month()).isEqualTo(1);
        assertThat(Card.of(7).month()).isEqualTo(4);
        assertThat(Card.of(20).month()).isEqualTo(10);
    }

    @Test
    void lightCardsAreOddCardsOfMonthsOneThreeEight() {
        List<Integer> lights = Card.all().stream().filter(Card::isLight).map(Card::id).toList();
        assertThat(lights).containsExactly(1, 5, 15);
    }

    @Test
    void animalCardsAreEvenIds() {
        assertThat(Card.all().stream().filter(Card::isAnimal).map(Card::id))
                .containsExactly(2, 4, 6, 8, 10, 12, 14, 16, 18, 20);
    }

    @Test
    void invalidIdIsRejected() {
        assertThatThrownBy(() -> Card.of(0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Card.of(21)).isInstanceOf(ValidationException.class);
    }

    @Test
    void deckDealsEachCardOnce() {
        Deck deck = new ShuffledDeckFactory(new java.util.Random(7)).newDeck();
        HashSet<Card> seen = new HashSet<>();
        for (int i = 0; i < 10; i++) {
            seen.addAll(deck.deal(2));
        }
        assertThat(seen).hasSize(20);
        assertThat(deck.remaining()).isZero();
        assertThatThrownBy(() -> deck.deal(1)).isInstanceOf(GameStateException.class);
    }
}
