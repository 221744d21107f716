package com.riansoft.tsp_arena.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 도시 목록과 대칭 거리 행렬. 생성 이후 변경되지 않습니다.
 * {@code matrix[i][j]}는 {@code cities.get(i)}와 {@code cities.get(j)} 사이의 거리입니다.
 */
public final class DistanceModel {

    private final List<City> cities;
    private final int[][] matrix;
    private final int[] positionByCity;

    public DistanceModel(List<City> cities, int[][] matrix) {
        if (cities.size() != matrix.length) {
            throw new IllegalArgumentException("matrix must have one row per city");
        }
        this.cities = Collections.unmodifiableList(new ArrayList<>(cities));
        this.matrix = new int[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i].length != cities.size()) {
                throw new IllegalArgumentException("matrix must be square");
            }
            this.matrix[i] = matrix[i].clone();
        }
        // 대각선 0, 대칭, 음수 없음
        for (int i = 0; i < this.matrix.length; i++) {
            if (this.matrix[i][i] != 0) {
                throw new IllegalArgumentException("diagonal must be zero at " + i);
            }
            for (int j = i + 1; j < this.matrix.length; j++) {
                if (this.matrix[i][j] < 0) {
                    throw new IllegalArgumentException("negative distance at " + i + "," + j);
                }
                if (this.matrix[i][j] != this.matrix[j][i]) {
                    throw new IllegalArgumentException("matrix must be symmetric at " + i + "," + j);
                }
            }
        }
        this.positionByCity = new int[City.ALPHABET_SIZE];
        Arrays.fill(positionByCity, -1);
        for (int i = 0; i < this.cities.size(); i++) {
            City city = this.cities.get(i);
            if (positionByCity[city.index] != -1) {
                throw new IllegalArgumentException("duplicate city: " + city);
            }
            positionByCity[city.index] = i;
        }
    }

    public List<City> getCities() {
        return cities;
    }

    public int size() {
        return cities.size();
    }

    public boolean contains(City city) {
        return city != null && positionByCity[city.index] != -1;
    }

    public int distance(City from, City to) {
        return matrix[position(from)][position(to)];
    }

    /**
     * 경로를 따라 인접한 두 도시 사이 거리를 모두 더합니다.
     */
    public long routeDistance(List<City> route) {
        long total = 0;
        for (int i = 0; i < route.size() - 1; i++) {
            total += distance(route.get(i), route.get(i + 1));
        }
        return total;
    }

    /**
     * 행렬의 사본. 호출자가 수정해도 모델에는 영향이 없습니다.
     */
    public int[][] getMatrix() {
        int[][] copy = new int[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }

    private int position(City city) {
        int pos = positionByCity[city.index];
        if (pos == -1) {
            throw new IllegalArgumentException("city not in model: " + city);
        }
        return pos;
    }
}
