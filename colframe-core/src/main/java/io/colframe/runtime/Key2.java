package io.colframe.runtime;

import java.util.Comparator;

public record Key2<A, B>(A first, B second) implements CompositeKey {

    /**
     * Lexicographic order over the two components.
     */
    public static <A, B> Comparator<Key2<A, B>> comparator(Comparator<? super A> first,
            Comparator<? super B> second) {
        return (left, right) -> {
            var cmp = first.compare(left.first, right.first);
            if (cmp != 0) {
                return cmp;
            }
            return second.compare(left.second, right.second);
        };
    }

    @Override
    public int arity() {
        return 2;
    }

    @Override
    public Object get(int index) {
        return switch (index) {
            case 0 -> first;
            case 1 -> second;
            default -> throw new IndexOutOfBoundsException("Key2 has two components, requested " + index);
        };
    }
}
