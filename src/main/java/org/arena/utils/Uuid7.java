package org.arena.utils;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * UUIDv7：48 位毫秒时间戳 + 随机数，按时间有序
 */
public final class Uuid7 {

    private static final SecureRandom RANDOM = new SecureRandom();

    private Uuid7() {
    }

    public static UUID randomUuid() {
        return fromMillis(System.currentTimeMillis());
    }

    public static String next() {
        return randomUuid().toString();
    }

    static UUID fromMillis(long millis) {
        long randA = RANDOM.nextInt(1 << 12);
        long randB = RANDOM.nextLong() & 0x3FFFFFFFFFFFFFFFL;
        long msb = ((millis & 0xFFFFFFFFFFFFL) << 16) | 0x7000L | randA;
        long lsb = 0x8000000000000000L | randB;
        return new UUID(msb, lsb);
    }
}
