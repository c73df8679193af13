package io.colframe.runtime.dispatch;

import io.colframe.runtime.Key1;
import io.colframe.runtime.Key2;
import io.colframe.runtime.Key3;
import io.colframe.runtime.KeyHandler;
import io.colframe.runtime.KeyPlan;
import io.colframe.storage.DataFrameView;

import java.util.Comparator;
import java.util.function.IntFunction;

/**
 * Key plans of arity one to three, each parameterised by the handlers of its
 * component kinds.
 */
public final class KeyPlans {

    private KeyPlans() {
    }

    public static <A> KeyPlan<Key1<A>> plan(KeyHandler<A> first) {
        return new Plan1<>(first);
    }

    public static <A, B> KeyPlan<Key2<A, B>> plan(KeyHandler<A> first, KeyHandler<B> second) {
        return new Plan2<>(first, second);
    }

    public static <A, B, C> KeyPlan<Key3<A, B, C>> plan(KeyHandler<A> first,
            KeyHandler<B> second,
            KeyHandler<C> third) {
        return new Plan3<>(first, second, third);
    }

    private static final class Plan1<A> extends AbstractKeyPlan<Key1<A>> {
        private final KeyHandler<A> first;
        private final Comparator<Key1<A>> comparator;

        Plan1(KeyHandler<A> first) {
            super(first);
            this.first = first;
            this.comparator = Key1.comparator(first);
        }

        @Override
        public IntFunction<Key1<A>> keyReader(DataFrameView view, int[] keyColumns) {
            var columns = keyColumns(view, keyColumns);
            return row -> new Key1<>(first.read(columns[0], view.sourceRow(row)));
        }

        @Override
        @SuppressWarnings("unchecked")
        Key1<A>[] newKeys(int length) {
            return (Key1<A>[]) new Key1[length];
        }

        @Override
        public Comparator<Key1<A>> comparator() {
            return comparator;
        }
    }

    private static final class Plan2<A, B> extends AbstractKeyPlan<Key2<A, B>> {
        private final KeyHandler<A> first;
        private final KeyHandler<B> second;
        private final Comparator<Key2<A, B>> comparator;

        Plan2(KeyHandler<A> first, KeyHandler<B> second) {
            super(first, second);
            this.first = first;
            this.second = second;
            this.comparator = Key2.comparator(first, second);
        }

        @Override
        public IntFunction<Key2<A, B>> keyReader(DataFrameView view, int[] keyColumns) {
            var columns = keyColumns(view, keyColumns);
            return row -> {
                var source = view.sourceRow(row);
                return new Key2<>(first.read(columns[0], source), second.read(columns[1], source));
            };
        }

        @Override
        @SuppressWarnings("unchecked")
        Key2<A, B>[] newKeys(int length) {
            return (Key2<A, B>[]) new Key2[length];
        }

        @Override
        public Comparator<Key2<A, B>> comparator() {
            return comparator;
        }
    }

    private static final class Plan3<A, B, C> extends AbstractKeyPlan<Key3<A, B, C>> {
        private final KeyHandler<A> first;
        private final KeyHandler<B> second;
        private final KeyHandler<C> third;
        private final Comparator<Key3<A, B, C>> comparator;

        Plan3(KeyHandler<A> first, KeyHandler<B> second, KeyHandler<C> third) {
            super(first, second, third);
            this.first = first;
            this.second = second;
            this.third = third;
            this.comparator = Key3.comparator(first, second, third);
        }

        @Override
        public IntFunction<Key3<A, B, C>> keyReader(DataFrameView view, int[] keyColumns) {
            var columns = keyColumns(view, keyColumns);
            return row -> {
                var source = view.sourceRow(row);
                return new Key3<>(first.read(columns[0], source),
                        second.read(columns[1], source),
                        third.read(columns[2], source));
            };
        }

        @Override
        @SuppressWarnings("unchecked")
        Key3<A, B, C>[] newKeys(int length) {
            return (Key3<A, B, C>[]) new Key3[length];
        }

        @Override
        public Comparator<Key3<A, B, C>> comparator() {
            return comparator;
        }
    }
}
