/*
 * Copyright 2019 Zoey Hewll
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package unimelb.functional.algebraic;

import org.jetbrains.annotations.Nullable;
import unimelb.functional.function.PartialFunction;
import unimelb.functional.throwing.ThrowingConsumer;
import unimelb.functional.throwing.ThrowingFunction;
import unimelb.functional.throwing.ThrowingRunnable;
import unimelb.functional.throwing.ThrowingSupplier;
import unimelb.functional.util.AssertUtil;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * <p>A container which may be empty, or hold a non-null value; and provides pattern matching to safely unwrap the data.
 * <br>
 * <p>The only possible subclasses are {@link Empty} and {@link Present}.
 * <h3>Examples:</h3>
 * In each example, an underscore (_) represents a placeholder for any valid value, where the specific value doesn't affect the output.
 * <pre> {@code
 * f(x) = y
 * g(x) = of(y);
 * h(x) = empty();
 *
 * of(x).map(f) == of(y)
 * of(x).flatMap(g) == of(y)
 * of(x).flatMap(h) == empty()
 * }
 *
 * Empty always yields Empty:
 * {@code
 * empty().map(_) == empty()
 * empty().flatMap(_) == empty()
 * empty().filter(_) == empty()
 * }
 *
 * Folding safely unwraps the data and applies the matched operation:
 * {@code
 * of(x).fold(_, x -> y) == y
 * empty().fold(() -> z, _) == z
 * } </pre>
 *
 * @param <T> The type of the optional value
 * @author Zoey Hewll
 */
public abstract class Optional<T> implements ThrowingSupplier<T, IllegalArgumentException>
{
    /**
     * Singleton instance of the empty variant.
     */
    private static final Empty<?> EMPTY = new Empty<>();

    /**
     * Private constructor to seal the type.
     */
    private Optional() {}

    /**
     * Decide control flow based on the structure of the Optional,
     * returning a result or throwing a checked exception.
     *
     * @param some the operation to perform on the contained value if there is one
     * @param none the operation to perform if there is no contained value
     * @param <U>  the type of the value returned by the supplied operations
     * @param <E>  the exception type which may be thrown by one or both operations
     * @return the result of the matched operation
     * @throws E the exception thrown by the supplied operations
     */
    public abstract <U, E extends Throwable> U unsafeMatchThen(ThrowingFunction<? super T, ? extends U, ? extends E> some, ThrowingSupplier<? extends U, ? extends E> none) throws E;

    /**
     * Decide control flow based on the structure of the Optional,
     * optionally throwing a checked exception.
     *
     * @param some the operation to perform on the contained value if there is one
     * @param none the operation to perform if there is no contained value
     * @param <E>  the exception type which may be thrown by one or both operations
     * @throws E the exception thrown by the supplied operations
     */
    public abstract <E extends Throwable> void unsafeMatch(ThrowingConsumer<? super T, ? extends E> some, ThrowingRunnable<? extends E> none) throws E;

    /**
     * Invokes exactly one of the given functions: {@code onEmpty} when there is no contained value,
     * {@code onPresent} with the contained value otherwise.
     *
     * @param onEmpty   the operation to perform if there is no contained value
     * @param onPresent the operation to perform on the contained value if there is one
     * @param <U>       the type of the value returned by the supplied operations
     * @return the result of the matched operation
     */
    public <U> U fold(Supplier<? extends U> onEmpty, Function<? super T, ? extends U> onPresent)
    {
        return unsafeMatchThen(
                onPresent::apply,
                onEmpty::get);
    }

    /**
     * Decide control flow based on the structure of the Optional.
     *
     * @param some the operation to perform on the contained value if there is one
     * @param none the operation to perform if there is no contained value
     */
    public void match(Consumer<? super T> some, Runnable none)
    {
        unsafeMatch(
                some::accept,
                none::run);
    }

    /**
     * Applies the mapping function if there is a contained value, returning the result in an Optional.
     * A null result produces an empty Optional.
     *
     * @param mapper the function to apply to the contained value
     * @param <U>    the type of the function's return value
     * @return the mapped Optional
     */
    public abstract <U> Optional<U> map(Function<? super T, ? extends U> mapper);

    /**
     * Performs the operation on any contained value and returns the resulting Optional if there is one.
     *
     * @param mapper the function to apply to the contained value
     * @param <U>    the type of the function's optional return value
     * @return the Optional returned by the function, or empty
     */
    public abstract <U> Optional<U> flatMap(Function<? super T, ? extends Optional<? extends U>> mapper);

    /**
     * Returns this Optional if it holds a value matching the predicate, otherwise an empty one.
     * The predicate is not evaluated on an empty Optional.
     *
     * @param predicate the condition the contained value must meet
     * @return this Optional or an empty one
     */
    public abstract Optional<T> filter(Predicate<? super T> predicate);

    /**
     * Returns the contained value, if it exists, otherwise raise an exception.
     *
     * @return The contained value, if it exists
     * @throws IllegalArgumentException if nothing is contained
     */
    @Override
    public abstract T get() throws IllegalArgumentException;

    /**
     * Applies the partial function to the contained value when the value belongs to its domain.
     * {@link PartialFunction#apply} is never called outside the domain.
     *
     * @param partialFunction the partial function to apply
     * @param <U>             the return type of the partial function
     * @return an Optional with the result, or empty if there is no value or it is outside the domain
     */
    public <U> Optional<U> collect(PartialFunction<? super T, ? extends U> partialFunction)
    {
        AssertUtil.notNull(partialFunction, "partialFunction must be not null");
        if (isPresent() && partialFunction.isDefinedAt(get()))
        {
            return Optional.<U>ofNullable(partialFunction.apply(get()));
        }
        return empty();
    }

    /**
     * Returns the contained value, or the supplied default if it does not exist.
     * A null default must be typed, as in {@code getOrElse((T) null)}, to select this overload.
     *
     * @param other the default value to use
     * @return the contained value, or the supplied default if it does not exist
     */
    public T getOrElse(T other)
    {
        return fold(
                () -> other,
                (T t) -> t
        );
    }

    /**
     * Returns the contained value, or the value of the supplier if it does not exist.
     * The supplier is only invoked when there is no contained value.
     *
     * @param supplier the supplier of the value to use
     * @return the contained value, or the supplied default if it does not exist
     */
    public T getOrElse(Supplier<? extends T> supplier)
    {
        return fold(
                () -> AssertUtil.notNull(supplier, "supplier must be not null").get(),
                (T t) -> t
        );
    }

    /**
     * Returns this Optional if it holds a value, otherwise the given one.
     *
     * @param other the alternative Optional
     * @return this or {@code other}
     */
    public Optional<T> orElse(Optional<T> other)
    {
        return isPresent()
                ? this
                : AssertUtil.notNull(other, "other must be not null");
    }

    /**
     * Returns the contained value, or raises the exception built by the supplier.
     *
     * @param errorSupplier builds the exception to raise, only invoked when there is no contained value
     * @param <X>           the type of exception raised
     * @return the contained value
     * @throws X if there is no contained value
     * @throws IllegalArgumentException if there is no contained value and the supplier returns null
     */
    public <X extends Throwable> T orElseThrow(Supplier<? extends X> errorSupplier) throws X
    {
        if (isPresent())
        {
            return get();
        }
        X error = AssertUtil.notNull(errorSupplier, "errorSupplier must be not null").get();
        throw AssertUtil.notNull(error, "errorSupplier must supply a not null exception");
    }

    /**
     * Returns true if there is a contained value.
     */
    public boolean isPresent()
    {
        return fold(
                () -> false,
                (T t) -> true
        );
    }

    /**
     * Returns true if there is no contained value.
     */
    public boolean isEmpty()
    {
        return !isPresent();
    }

    /**
     * Performs the action on the contained value, if there is one.
     *
     * @param action the action to perform
     */
    public void ifPresent(Consumer<? super T> action)
    {
        unsafeMatch(
                (T t) -> AssertUtil.notNull(action, "action must be not null").accept(t),
                () -> {}
        );
    }

    /**
     * Converts this Optional into the equivalent {@link java.util.Optional}.
     */
    public java.util.Optional<T> toJavaOptional()
    {
        return fold(
                () -> java.util.Optional.<T>empty(),
                (T t) -> java.util.Optional.of(t)
        );
    }

    /**
     * Converts a nullable value into an equivalent Optional, returning empty if the value is null, and of(value) otherwise.
     *
     * @param value the value to wrap
     * @param <T>   The type of the optional value
     * @return empty() if the value is null, and of(value) otherwise
     */
    public static <T> Optional<T> ofNullable(@Nullable T value)
    {
        return value == null
                ? empty()
                : of(value);
    }

    /**
     * Turns a {@link java.util.Optional} into an Optional holding the same value.
     *
     * @param value the optional to transform
     * @param <T>   The type of the optional value
     * @return An Optional mirroring the parameter
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static <T> Optional<T> fromJavaOptional(java.util.Optional<T> value)
    {
        return AssertUtil.notNull(value, "value must be not null")
                .map(Optional::of)
                .orElseGet(Optional::empty);
    }

    /**
     * Wraps the value in an Optional.
     *
     * @param value The value to wrap
     * @param <T>   The type of the contained value
     * @return The value wrapped in an Optional
     * @throws IllegalArgumentException if the value is null
     */
    public static <T> Optional<T> of(T value)
    {
        return new Present<>(AssertUtil.notNull(value));
    }

    /**
     * Returns the singleton empty instance.
     *
     * @param <T> The type of the non-existent contained value
     * @return The singleton empty instance
     */
    public static <T> Optional<T> empty()
    {
        @SuppressWarnings("unchecked") Empty<T> empty = (Empty<T>) EMPTY;
        return empty;
    }

    /**
     * Upcast the container by upcasting the contained type.
     */
    static <T> Optional<T> cast(Optional<? extends T> o)
    {
        return o.fold(Optional::<T>empty, t -> Optional.<T>of(t));
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    public abstract String toString();

    /**
     * The class representing an absent value.
     *
     * @param <T> unused
     */
    private static class Empty<T> extends Optional<T>
    {
        @Override
        public boolean equals(Object o)
        {
            return o instanceof Empty;
        }

        @Override
        public int hashCode()
        {
            return Objects.hashCode(Empty.class);
        }

        @Override
        public String toString()
        {
            return "Optional.empty()";
        }

        @Override
        public <U, E extends Throwable> U unsafeMatchThen(ThrowingFunction<? super T, ? extends U, ? extends E> some, ThrowingSupplier<? extends U, ? extends E> none) throws E
        {
            return none.get();
        }

        @Override
        public <E extends Throwable> void unsafeMatch(ThrowingConsumer<? super T, ? extends E> some, ThrowingRunnable<? extends E> none) throws E
        {
            none.run();
        }

        @Override
        public <U> Optional<U> map(Function<? super T, ? extends U> mapper)
        {
            return empty();
        }

        @Override
        public <U> Optional<U> flatMap(Function<? super T, ? extends Optional<? extends U>> mapper)
        {
            return empty();
        }

        @Override
        public Optional<T> filter(Predicate<? super T> predicate)
        {
            return this;
        }

        @Override
        public T get() throws IllegalArgumentException
        {
            throw new IllegalArgumentException("Is not possible to get the value of an empty Optional");
        }
    }

    /**
     * The class representing a present value.
     *
     * @param <T> The type of the contained value.
     */
    private static class Present<T> extends Optional<T>
    {
        /**
         * The contained value, never null.
         */
        final T value;

        Present(T value)
        {
            this.value = value;
        }

        @Override
        public boolean equals(Object o)
        {
            if (o instanceof Present)
            {
                Present<?> p = (Present<?>) o;
                return Objects.deepEquals(value, p.value);
            }
            return false;
        }

        @Override
        public int hashCode()
        {
            return Arrays.deepHashCode(new Object[] {Present.class, value});
        }

        @Override
        public String toString()
        {
            return "Optional.of(" + value + ')';
        }

        @Override
        public <U, E extends Throwable> U unsafeMatchThen(ThrowingFunction<? super T, ? extends U, ? extends E> some, ThrowingSupplier<? extends U, ? extends E> none) throws E
        {
            return some.apply(value);
        }

        @Override
        public <E extends Throwable> void unsafeMatch(ThrowingConsumer<? super T, ? extends E> some, ThrowingRunnable<? extends E> none) throws E
        {
            some.accept(value);
        }

        @Override
        public <U> Optional<U> map(Function<? super T, ? extends U> mapper)
        {
            return Optional.<U>ofNullable(AssertUtil.notNull(mapper, "mapper must be not null").apply(value));
        }

        @Override
        public <U> Optional<U> flatMap(Function<? super T, ? extends Optional<? extends U>> mapper)
        {
            return cast(AssertUtil.notNull(mapper, "mapper must be not null").apply(value));
        }

        @Override
        public Optional<T> filter(Predicate<? super T> predicate)
        {
            return AssertUtil.notNull(predicate, "predicate must be not null").test(value)
                    ? this
                    : empty();
        }

        @Override
        public T get()
        {
            return value;
        }
    }
}
