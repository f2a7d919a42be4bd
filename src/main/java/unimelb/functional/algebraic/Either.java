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
import unimelb.functional.combinator.Combinators;
import unimelb.functional.throwing.ThrowingConsumer;
import unimelb.functional.throwing.ThrowingFunction;
import unimelb.functional.util.AssertUtil;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * <p>A container which holds a value of one of two types; and provides pattern matching to safely unwrap the data.
 * By convention, the Left constructor is used to hold an error value and the Right constructor is used to hold a correct value.
 * <p>
 * <p>The type is sealed with a private constructor to ensure the only subclasses are {@link Left} and {@link Right}.
 * <p>
 * <p>Instances of the same structure containing the same data are considered equal.
 *
 * @param <L> The left alternative type
 * @param <R> The right alternative type
 * @author Zoey Hewll
 */
public abstract class Either<L, R>
{
    /**
     * Private constructor to seal the type.
     */
    private Either() {}

    public abstract int hashCode();

    public abstract boolean equals(Object o);

    public abstract String toString();

    /**
     * Match on the contained value, applying the function pertaining to the contained type, and returning the result.
     * Both functions must have the same return and throw types.
     *
     * @param lf  The function to apply to the contained value if it is a {@link Left} value.
     * @param rf  The function to apply to the contained value if it is a {@link Right} value.
     * @param <T> The return type of the functions.
     * @param <E> The type of the error thrown by the functions.
     * @return The value returned by the matched function.
     * @throws E The error thrown by the functions.
     */
    public abstract <T, E extends Throwable> T unsafeMatch(ThrowingFunction<? super L, ? extends T, ? extends E> lf, ThrowingFunction<? super R, ? extends T, ? extends E> rf) throws E;

    /**
     * Match on the contained value, performing the operation pertaining to the contained type.
     *
     * @param lf  The operation to perform on the contained value if it is a {@link Left} value.
     * @param rf  The operation to perform on the contained value if it is a {@link Right} value.
     * @param <E> The type of the error thrown by the operation.
     * @throws E The error thrown by the operation.
     */
    public abstract <E extends Throwable> void unsafeMatch(ThrowingConsumer<? super L, ? extends E> lf, ThrowingConsumer<? super R, ? extends E> rf) throws E;

    /**
     * Match on the contained value, applying the function pertaining to the contained type, and returning the result.
     *
     * @param lf  The function to apply to the contained value if it is a {@link Left} value.
     * @param rf  The function to apply to the contained value if it is a {@link Right} value.
     * @param <T> The return type of the functions.
     * @return The value returned by the matched function.
     */
    public <T> T matchThen(Function<? super L, ? extends T> lf, Function<? super R, ? extends T> rf)
    {
        return unsafeMatch(
                lf::apply,
                rf::apply);
    }

    /**
     * Match on the contained value, performing the operation pertaining to the contained type.
     *
     * @param lf The operation to perform on the contained value if it is a {@link Left} value.
     * @param rf The operation to perform on the contained value if it is a {@link Right} value.
     */
    public void match(Consumer<? super L> lf, Consumer<? super R> rf)
    {
        unsafeMatch(
                lf::accept,
                rf::accept);
    }

    /**
     * <p>Apply a function to the contained value, and return an {@link Either} corresponding to the return types.
     * <p>This does not change the enclosing structure, i.e.:
     * {@code left(x).bimap(a,b).isLeft() == true}
     * {@code right(x).bimap(a,b).isRight() == true}
     *
     * @param lf  The function to apply to the contained value if it is a {@link Left} value.
     * @param rf  The function to apply to the contained value if it is a {@link Right} value.
     * @param <A> The type of the {@link Left} function
     * @param <B> The type of the {@link Right} function
     * @return An {@link Either} containing the return value of the matched function
     */
    public <A, B> Either<A, B> bimap(Function<? super L, ? extends A> lf, Function<? super R, ? extends B> rf)
    {
        return matchThen(
                (L l) -> left(lf.apply(l)),
                (R r) -> right(rf.apply(r))
        );
    }

    /**
     * Applies the function to a {@link Right} value, leaving a {@link Left} value untouched.
     *
     * @param f   the function to apply
     * @param <B> the new right type
     * @return the mapped Either
     */
    public <B> Either<L, B> map(Function<? super R, ? extends B> f)
    {
        return matchThen(
                (L l) -> left(l),
                (R r) -> right(AssertUtil.notNull(f, "mapper must be not null").apply(r))
        );
    }

    /**
     * Applies the function to a {@link Left} value, leaving a {@link Right} value untouched.
     *
     * @param f   the function to apply
     * @param <A> the new left type
     * @return the mapped Either
     */
    public <A> Either<A, R> mapLeft(Function<? super L, ? extends A> f)
    {
        return matchThen(
                (L l) -> left(AssertUtil.notNull(f, "mapper must be not null").apply(l)),
                (R r) -> right(r)
        );
    }

    /**
     * Produce an Either from the {@link Right} value, or propagate the {@link Left} value.
     *
     * @param f   the function to bind
     * @param <B> the new right type
     * @return the result of the bound computation
     */
    public <B> Either<L, B> flatMap(Function<? super R, ? extends Either<? extends L, ? extends B>> f)
    {
        return matchThen(
                (L l) -> left(l),
                (R r) -> cast(AssertUtil.notNull(f, "mapper must be not null").apply(r))
        );
    }

    /**
     * Returns the contained value if it is a {@link Left} value, otherwise returns the provided value.
     *
     * @param left The default value to use if the contained value is not {@link Left}.
     * @return the contained value if it is a {@link Left} value, otherwise the provided value.
     */
    public L fromLeft(L left)
    {
        return matchThen(
                (L l) -> l,
                (R r) -> left
        );
    }

    /**
     * Returns the contained value if it is a {@link Right} value, otherwise returns the provided value.
     *
     * @param right The default value to use if the contained value is not {@link Right}.
     * @return the contained value if it is a {@link Right} value, otherwise the provided value.
     */
    public R fromRight(R right)
    {
        return matchThen(
                (L l) -> right,
                (R r) -> r
        );
    }

    /**
     * Returns the {@link Right} value.
     *
     * @return the contained right value
     * @throws IllegalStateException if this is a {@link Left} value
     */
    public R get()
    {
        return matchThen(
                (L l) -> { throw new IllegalStateException("Is not possible to get a right value of a 'Left' Either"); },
                (R r) -> r
        );
    }

    /**
     * Returns the {@link Left} value.
     *
     * @return the contained left value
     * @throws IllegalStateException if this is a {@link Right} value
     */
    public L getLeft()
    {
        return matchThen(
                (L l) -> l,
                (R r) -> { throw new IllegalStateException("Is not possible to get a left value of a 'Right' Either"); }
        );
    }

    /**
     * Performs the provided operation on the contained value if it is a {@link Left} value.
     *
     * @param lf The operation to optionally perform.
     */
    public void ifLeft(Consumer<? super L> lf)
    {
        match(
                lf,
                Combinators::noop
        );
    }

    /**
     * Performs the provided operation on the contained value if it is a {@link Right} value.
     *
     * @param rf The operation to optionally perform.
     */
    public void ifRight(Consumer<? super R> rf)
    {
        match(
                Combinators::noop,
                rf
        );
    }

    /**
     * Returns whether the contained value is {@link Left}.
     *
     * @return true if the contained value is {@link Left}.
     */
    public boolean isLeft()
    {
        return matchThen(
                (L l) -> true,
                (R r) -> false
        );
    }

    /**
     * Returns whether the contained value is {@link Right}.
     *
     * @return true if the contained value is {@link Right}.
     */
    public boolean isRight()
    {
        return matchThen(
                (L l) -> false,
                (R r) -> true
        );
    }

    /**
     * Merges this Either with another one:
     * <ul>
     *   <li>right and right: a {@link Right} holding {@code mapperRight(this value, other value)}</li>
     *   <li>right and left: the other one</li>
     *   <li>left and right: this one</li>
     *   <li>left and left: a {@link Left} holding {@code mapperLeft(this value, other value)}</li>
     * </ul>
     * Anything thrown by the merging functions is relayed to the caller.
     *
     * @param other       the Either to merge with; when null, this Either is returned
     * @param mapperLeft  merges two left values, required only when both are {@link Left}
     * @param mapperRight merges two right values, required only when both are {@link Right}
     * @return the merged Either
     */
    public Either<L, R> ap(@Nullable Either<L, R> other,
                           BiFunction<? super L, ? super L, ? extends L> mapperLeft,
                           BiFunction<? super R, ? super R, ? extends R> mapperRight)
    {
        if (other == null)
        {
            return this;
        }
        if (isRight())
        {
            if (other.isRight())
            {
                return right(AssertUtil.notNull(mapperRight, "mapperRight must be not null")
                        .apply(get(), other.get()));
            }
            return other;
        }
        if (other.isRight())
        {
            return this;
        }
        return left(AssertUtil.notNull(mapperLeft, "mapperLeft must be not null")
                .apply(getLeft(), other.getLeft()));
    }

    /**
     * Returns true if this is a {@link Right} holding a value equal to the given one.
     */
    public boolean contain(@Nullable R value)
    {
        return isRight() && Objects.equals(value, get());
    }

    /**
     * Keeps a {@link Right} whose value matches the predicate.
     * A {@link Left}, or a null predicate, leaves this Either unchanged.
     *
     * @return this Either, or null when the right value does not match
     * @see #filterOptional(Predicate)
     */
    @Nullable
    public Either<L, R> filter(@Nullable Predicate<? super R> predicate)
    {
        if (isLeft() || predicate == null)
        {
            return this;
        }
        return predicate.test(get())
                ? this
                : null;
    }

    /**
     * As {@link #filter(Predicate)}, with the missing result represented by an empty {@link Optional}.
     */
    public Optional<Either<L, R>> filterOptional(@Nullable Predicate<? super R> predicate)
    {
        return Optional.ofNullable(filter(predicate));
    }

    /**
     * Keeps a {@link Right} whose value matches the predicate, otherwise turns it into a {@link Left}
     * holding the value supplied by {@code zero}.
     * A {@link Left}, or a null predicate, leaves this Either unchanged.
     *
     * @throws IllegalArgumentException if the right value does not match and {@code zero} is null
     */
    public Either<L, R> filterOrElse(@Nullable Predicate<? super R> predicate, Supplier<? extends L> zero)
    {
        if (isLeft() || predicate == null || predicate.test(get()))
        {
            return this;
        }
        return left(AssertUtil.notNull(zero, "zero must be not null").get());
    }

    /**
     * Returns the {@link Right} value, or the given default for a {@link Left}.
     * A null default must be typed, as in {@code getOrElse((R) null)}, to select this overload.
     */
    public R getOrElse(R other)
    {
        return fromRight(other);
    }

    /**
     * Returns the {@link Right} value, or the value of the supplier for a {@link Left}.
     * The supplier is only invoked for a {@link Left}.
     */
    public R getOrElse(Supplier<? extends R> other)
    {
        return matchThen(
                (L l) -> AssertUtil.notNull(other, "other must be not null").get(),
                (R r) -> r
        );
    }

    /**
     * Returns this Either if it is a {@link Right}, otherwise the given one.
     */
    public Either<L, R> orElse(Either<L, R> other)
    {
        return isRight()
                ? this
                : AssertUtil.notNull(other, "other must be not null");
    }

    /**
     * Returns this Either if it is a {@link Right}, otherwise the one computed by the supplier.
     * The supplier is only invoked for a {@link Left}.
     */
    public Either<L, R> orElse(Supplier<? extends Either<? extends L, ? extends R>> other)
    {
        return isRight()
                ? this
                : cast(AssertUtil.notNull(other, "other must be not null").get());
    }

    /**
     * Returns true for a {@link Left}, or a {@link Right} holding null.
     */
    public boolean isEmpty()
    {
        return isLeft() || get() == null;
    }

    /**
     * Exchanges the sides: a {@link Left} value becomes {@link Right} and vice versa.
     *
     * @return the swapped Either
     */
    public Either<R, L> swap()
    {
        return matchThen(
                (L l) -> right(l),
                (R r) -> left(r)
        );
    }

    /**
     * Returns the {@link Right} value wrapped in an {@link Optional}, empty for a {@link Left} or a null right value.
     */
    public Optional<R> toOptional()
    {
        return matchThen(
                (L l) -> Optional.<R>empty(),
                (R r) -> Optional.ofNullable(r)
        );
    }

    /**
     * Converts to a {@link Try}, turning a {@link Left} value into a failure using the given function.
     *
     * @param mapperLeft converts the left value into the failure's exception
     * @return a success holding the right value, or a failure
     */
    public Try<R> toTry(Function<? super L, ? extends Exception> mapperLeft)
    {
        return matchThen(
                (L l) -> Try.<R>failure(AssertUtil.notNull(mapperLeft, "mapperLeft must be not null").apply(l)),
                (R r) -> Try.success(r)
        );
    }

    /**
     * Converts to a {@link Validation}.
     *
     * @see Validation#fromEither(Either)
     */
    public Validation<L, R> toValidation()
    {
        return Validation.fromEither(this);
    }

    /**
     * Merges the given Eithers from left to right with {@link #ap}.
     * Null elements are skipped.
     *
     * @param mapperLeft  merges two left values
     * @param mapperRight merges two right values
     * @param eithers     the Eithers to merge
     * @return the merged Either, or a {@link Right} holding null if {@code eithers} is null or empty
     */
    public static <L, R> Either<L, R> combine(BiFunction<? super L, ? super L, ? extends L> mapperLeft,
                                              BiFunction<? super R, ? super R, ? extends R> mapperRight,
                                              @Nullable List<Either<L, R>> eithers)
    {
        Either<L, R> result = null;
        for (Either<L, R> either : eithers == null ? Collections.<Either<L, R>>emptyList() : eithers)
        {
            result = result == null
                    ? either
                    : result.ap(either, mapperLeft, mapperRight);
        }
        return result == null
                ? Either.<L, R>right(null)
                : result;
    }

    /**
     * Evaluates the given suppliers in order, merging right values with {@code mapperRight},
     * and stops at the first {@link Left}, which is returned. Later suppliers are not invoked.
     * Suppliers returning null are skipped.
     *
     * @param mapperRight merges two right values
     * @param suppliers   the computations to evaluate
     * @return the first {@link Left}, or the merged {@link Right}; a {@link Right} holding null if
     *         {@code suppliers} is null or empty
     * @throws IllegalArgumentException if a supplier is null
     */
    public static <L, R> Either<L, R> combineGetFirstLeft(BiFunction<? super R, ? super R, ? extends R> mapperRight,
                                                          @Nullable List<? extends Supplier<Either<L, R>>> suppliers)
    {
        Either<L, R> result = null;
        if (suppliers != null)
        {
            for (Supplier<Either<L, R>> supplier : suppliers)
            {
                Either<L, R> current = AssertUtil.notNull(supplier, "suppliers must not contain null elements").get();
                if (current == null)
                {
                    continue;
                }
                result = result == null
                        ? current
                        : result.ap(current, Combinators.returnFirst(), mapperRight);
                if (result.isLeft())
                {
                    return result;
                }
            }
        }
        return result == null
                ? Either.<L, R>right(null)
                : result;
    }

    /**
     * Returns an Either containing a {@link Left} value.
     *
     * @param value The value to contain
     * @param <L>   The type of the contained value
     * @param <R>   The unused type
     * @return An Either containing a {@link Left} value.
     */
    public static <L, R> Either<L, R> left(L value)
    {
        return new Left<>(value);
    }

    /**
     * Returns an Either containing a {@link Right} value.
     *
     * @param value The value to contain
     * @param <L>   The unused type
     * @param <R>   The type of the contained value
     * @return An Either containing a {@link Right} value.
     */
    public static <L, R> Either<L, R> right(R value)
    {
        return new Right<>(value);
    }

    /**
     * Returns an equivalent Either with more generic type parameters.
     */
    static <L, R> Either<L, R> cast(Either<? extends L, ? extends R> either)
    {
        return either.matchThen(
                (L l) -> left(l),
                (R r) -> right(r)
        );
    }

    /**
     * The class representing a Left value.
     *
     * @param <L> The type of the contained value
     * @param <R> The unused type
     */
    static class Left<L, R> extends Either<L, R>
    {
        final L value;

        Left(L value)
        {
            this.value = value;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(Left.class, value);
        }

        @Override
        public boolean equals(Object o)
        {
            if (o instanceof Left)
            {
                Left<?, ?> l = (Left<?, ?>) o;
                return Objects.equals(value, l.value);
            }
            return false;
        }

        @Override
        public String toString()
        {
            return "Either.left(" + value + ')';
        }

        @Override
        public <T, E extends Throwable> T unsafeMatch(ThrowingFunction<? super L, ? extends T, ? extends E> lf, ThrowingFunction<? super R, ? extends T, ? extends E> rf) throws E
        {
            return lf.apply(value);
        }

        @Override
        public <E extends Throwable> void unsafeMatch(ThrowingConsumer<? super L, ? extends E> lf, ThrowingConsumer<? super R, ? extends E> rf) throws E
        {
            lf.accept(value);
        }
    }

    /**
     * The class representing a Right value.
     *
     * @param <L> The unused type
     * @param <R> The type of the contained value
     */
    static class Right<L, R> extends Either<L, R>
    {
        final R value;

        Right(R value)
        {
            this.value = value;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(Right.class, value);
        }

        @Override
        public boolean equals(Object o)
        {
            if (o instanceof Right)
            {
                Right<?, ?> r = (Right<?, ?>) o;
                return Objects.equals(value, r.value);
            }
            return false;
        }

        @Override
        public String toString()
        {
            return "Either.right(" + value + ')';
        }

        @Override
        public <T, E extends Throwable> T unsafeMatch(ThrowingFunction<? super L, ? extends T, ? extends E> lf, ThrowingFunction<? super R, ? extends T, ? extends E> rf) throws E
        {
            return rf.apply(value);
        }

        @Override
        public <E extends Throwable> void unsafeMatch(ThrowingConsumer<? super L, ? extends E> lf, ThrowingConsumer<? super R, ? extends E> rf) throws E
        {
            rf.accept(value);
        }
    }
}
