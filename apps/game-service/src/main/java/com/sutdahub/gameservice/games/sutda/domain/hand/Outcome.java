package com.sutdahub.gameservice.games.sutda.domain.hand;

/** 两手牌比较结果 */
public enum Outcome {
    A_WINS,
    B_WINS,
    TIE;

    /** 交换比较双方后的结果 */
    public Outcome inverse() {
        return switch (this) {
            case A_WINS -> B_WINS;
            case B_WINS -> A_WINS;
            case TIE -> TIE;
        };
    }
}
