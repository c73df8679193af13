package io.colframe.runtime;

import java.util.Comparator;

public record Key3<A, B, C>(A first, B second, C third) implements CompositeKey {

    /**
     * Lexicographic order over the three components.
     */
    public static <A, B, C> Comparator<Key3<A, B, C>> comparator(Comparator<? super A> first,
            Comparator<? super B> second,
            Comparator<? super C> third) {
        return (left, right) -> {
            var cmp = first.compare(left.first, right.first);
            if (cmp != 0) {
                return cmp;
            }
            cmp = second.compare(left.second, right.second);
            if (cmp != 0) {
                return cmp;
            }
            return third.compare(left.third, right.third);
        };
    }

    @Override
    public int arity() {
        return 3;
    }

    @Override
    public Object get(int index) {
        return switch (index) {
            case 0 -> first;
            case 1 -> second;
            case 2 -> third;
            default -> throw new IndexOutOfBoundsException("Key3 has three components, requested " + index);
        };
    }
}
