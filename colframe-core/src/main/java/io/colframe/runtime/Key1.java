package io.colframe.runtime;

import java.util.Comparator;

public record Key1<A>(A first) implements CompositeKey {

    public static <A> Comparator<Key1<A>> comparator(Comparator<? super A> first) {
        return (left, right) -> first.compare(left.first, right.first);
    }

    @Override
    public int arity() {
        return 1;
    }

    @Override
    public Object get(int index) {
        if (index != 0) {
            throw new IndexOutOfBoundsException("Key1 has one component, requested " + index);
        }
        return first;
    }
}
