package com.copyleft.GiftsUnderSiege.global.util;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

public class RandomUtil {

    private static final SecureRandom random = new SecureRandom();

    /**
     * UUID 생성 (GameId, GiftId용)
     */
    public static String generateId() {
        return UUID.randomUUID().toString();
    }

    public static <T> void shuffle(List<T> list) {
        Collections.shuffle(list, random);
    }

    public static <T> T pickOne(T[] values) {
        return values[random.nextInt(values.length)];
    }

    /**
     * 가중치 비율대로 인덱스 하나를 뽑는다.
     */
    public static int pickWeightedIndex(int[] weights) {
        int total = 0;
        for (int w : weights) {
            if (w < 0) {
                throw new IllegalArgumentException("Weight must not be negative");
            }
            total += w;
        }
        if (total == 0) {
            throw new IllegalArgumentException("Total weight must be positive");
        }

        int roll = random.nextInt(total);
        for (int i = 0; i < weights.length; i++) {
            roll -= weights[i];
            if (roll < 0) {
                return i;
            }
        }
        return weights.length - 1;
    }
}
