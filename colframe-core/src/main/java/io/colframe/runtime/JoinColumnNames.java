package io.colframe.runtime;

import io.colframe.storage.DataFrameView;

import java.util.HashSet;
import java.util.List;

/**
 * Output column names of a join: each side suffixed, then right names that collide
 * with a left name or an earlier right name extended with the collision suffix
 * until unique.
 */
record JoinColumnNames(String[] left, String[] right) {

    static JoinColumnNames of(DataFrameView left, DataFrameView right, String leftSuffix, String rightSuffix,
            String collisionSuffix) {
        var leftNames = suffixed(left.columnNames(), leftSuffix);
        var rightNames = suffixed(right.columnNames(), rightSuffix);
        var taken = new HashSet<String>(leftNames.length + rightNames.length);
        for (var name : leftNames) {
            taken.add(name);
        }
        for (var i = 0; i < rightNames.length; i++) {
            while (taken.contains(rightNames[i])) {
                rightNames[i] += collisionSuffix;
            }
            taken.add(rightNames[i]);
        }
        return new JoinColumnNames(leftNames, rightNames);
    }

    private static String[] suffixed(List<String> names, String suffix) {
        var result = new String[names.size()];
        for (var i = 0; i < result.length; i++) {
            result[i] = suffix == null ? names.get(i) : names.get(i) + suffix;
        }
        return result;
    }

    String[] all() {
        var all = new String[left.length + right.length];
        System.arraycopy(left, 0, all, 0, left.length);
        System.arraycopy(right, 0, all, left.length, right.length);
        return all;
    }
}
