package com.riansoft.tsp_arena.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 고정된 알파벳 풀("A".."Z")에서 뽑은 도시.
 * 풀 안의 위치(index)로 전체 순서가 정해집니다.
 */
public final class City implements Comparable<City> {

    public static final int ALPHABET_SIZE = 26;

    private static final List<City> POOL;

    static {
        List<City> pool = new ArrayList<>(ALPHABET_SIZE);
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            pool.add(new City(String.valueOf((char) ('A' + i)), i));
        }
        POOL = Collections.unmodifiableList(pool);
    }

    public final String name;
    public final int index;

    private City(String name, int index) {
        this.name = name;
        this.index = index;
    }

    /**
     * 풀의 앞에서부터 {@code size}개의 도시를 반환합니다.
     */
    public static List<City> pool(int size) {
        if (size < 0 || size > ALPHABET_SIZE) {
            throw new IllegalArgumentException("pool size must be between 0 and " + ALPHABET_SIZE + ": " + size);
        }
        return POOL.subList(0, size);
    }

    /**
     * 이름으로 도시를 찾습니다. 풀에 없는 이름이면 {@code null}.
     */
    public static City of(String name) {
        if (name == null || name.length() != 1) return null;
        int i = name.charAt(0) - 'A';
        if (i < 0 || i >= ALPHABET_SIZE) return null;
        return POOL.get(i);
    }

    @Override
    public int compareTo(City other) {
        return Integer.compare(index, other.index);
    }

    // 풀 밖에서 생성되지 않으므로 동일성 비교로 충분합니다.
    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return name;
    }
}
