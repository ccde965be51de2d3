package com.sutdahub.gameservice.games.sutda.domain.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sutdahub.gameservice.common.error.ValidationException;
import com.sutdahub.gameservice.games.sutda.domain.constants.GameMessages;

import java.util.List;
import java.util.stream.IntStream;

/**
 * 一张花斗牌。
 * 编号 1..20，每月两张：月份 = ceil(id / 2)。
 * - 光牌：奇数编号且月份为 1 / 3 / 8（即 1、5、15 号）；
 * - 열끗（动物牌）：偶数编号。
 * 不可变，实例全局共享，JSON 序列化为编号本身。
 */
public final class Card implements Comparable<Card> {

    public static final int MIN_ID = 1;
    public static final int MAX_ID = 20;

    private static final Card[] CACHE = new Card[MAX_ID + 1];
    static {
        for (int i = MIN_ID; i <= MAX_ID; i++) {
            CACHE[i] = new Card(i);
        }
    }

    private final int id;

    private Card(int id) {
        this.id = id;
    }

    /**
     * 按编号取牌。
     * @throws ValidationException 编号不在 1..20
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Card of(int id) {
        if (id < MIN_ID || id > MAX_ID) {
            throw new ValidationException(GameMessages.formatInvalidCard(id));
        }
        return CACHE[id];
    }

    /** 整副牌（编号升序） */
    public static List<Card> all() {
        return IntStream.rangeClosed(MIN_ID, MAX_ID).mapToObj(Card::of).toList();
    }

    @JsonValue
    public int id() {
        return id;
    }

    public int month() {
        return (id + 1) / 2;
    }

    public boolean isLight() {
        int m = month();
        return (id % 2 == 1) && (m == 1 || m == 3 || m == 8);
    }

    public boolean isAnimal() {
        return id % 2 == 0;
    }

    @Override
    public int compareTo(Card o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Card c && c.id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return id + "(" + month() + "月" + (isLight() ? "光" : isAnimal() ? "열" : "") + ")";
    }
}
