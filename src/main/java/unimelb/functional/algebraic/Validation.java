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
import unimelb.functional.util.AssertUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * <p>A container holding either a valid value, or the ordered list of errors found while validating it.
 * Unlike {@link Try}, several errors may be gathered: see {@link #combine} and {@link #ap}.
 * <p>
 * <p>The type is sealed with a private constructor to ensure the only subclasses are {@link Valid} and {@link Invalid}.
 * A {@link Valid} may hold null; the errors of an {@link Invalid} are never null, but may be empty.
 * <p>
 * <p>Unlike {@link Try#ap}, the merging functions given to {@link #ap} are not guarded:
 * an exception thrown by one of them propagates to the caller, as there is no error of type {@code E} to hold it.
 * <p>
 * <p>Instances of the same structure containing the same data are considered equal.
 *
 * @param <E> The error type
 * @param <T> The value type
 */
public abstract class Validation<E, T>
{
    /**
     * Private constructor to seal the type.
     */
    private Validation() {}

    public abstract int hashCode();

    public abstract boolean equals(Object o);

    public abstract String toString();

    /**
     * Match on the validation, applying the function pertaining to its structure, and returning the result.
     *
     * @param onInvalid the function to apply to the errors of an {@link Invalid}
     * @param onValid   the function to apply to the value of a {@link Valid}
     * @param <U>       the return type of the functions
     * @return the value returned by the matched function
     */
    public abstract <U> U fold(Function<? super List<E>, ? extends U> onInvalid, Function<? super T, ? extends U> onValid);

    /**
     * Returns a valid Validation holding the given value, which may be null.
     */
    public static <E, T> Validation<E, T> valid(T value)
    {
        return new Valid<>(value);
    }

    /**
     * Returns an invalid Validation holding a copy of the given errors, in the same order.
     * A null list is treated as an empty one.
     */
    public static <E, T> Validation<E, T> invalid(@Nullable List<? extends E> errors)
    {
        List<E> copy = errors == null
                ? Collections.<E>emptyList()
                : Collections.unmodifiableList(new ArrayList<E>(errors));
        return new Invalid<>(copy);
    }

    /**
     * Merges every given Validation, left to right, with {@link #ap(Validation)}.
     * <ul>
     *   <li>null or empty list: a valid Validation holding null</li>
     *   <li>only valid elements: the last valid element</li>
     *   <li>otherwise: an invalid Validation holding the errors of every invalid element, in input order</li>
     * </ul>
     * Every element is inspected; null elements are skipped.
     *
     * @param validations the validations to merge
     * @param <E>         the error type
     * @param <T>         the value type
     * @return the merged validation
     */
    public static <E, T> Validation<E, T> combine(@Nullable List<Validation<E, T>> validations)
    {
        Validation<E, T> result = valid(null);
        if (validations != null)
        {
            for (Validation<E, T> validation : validations)
            {
                result = result.ap(validation);
            }
        }
        return result;
    }

    /**
     * Evaluates the given suppliers one at a time, in order, and stops at the first invalid result,
     * which is returned. Suppliers after it are never invoked.
     *
     * @param suppliers the validations to evaluate
     * @param <E>       the error type
     * @param <T>       the value type
     * @return the first invalid result, or the last valid one; a valid Validation holding null if
     *         {@code suppliers} is null or empty
     * @throws IllegalArgumentException if an evaluated element is null
     */
    public static <E, T> Validation<E, T> combineGetFirstInvalid(@Nullable List<? extends Supplier<? extends Validation<E, T>>> suppliers)
    {
        Validation<E, T> result = valid(null);
        if (suppliers != null)
        {
            for (Supplier<? extends Validation<E, T>> supplier : suppliers)
            {
                result = result.ap(AssertUtil.notNull(supplier, "suppliers must not contain null elements").get());
                if (!result.isValid())
                {
                    return result;
                }
            }
        }
        return result;
    }

    /**
     * Converts an {@link Either}: a right value becomes valid, a left value becomes the single error of an
     * invalid Validation. A null Either, or a null left value, gives an invalid Validation without errors.
     */
    public static <E, T> Validation<E, T> fromEither(@Nullable Either<? extends E, ? extends T> either)
    {
        if (either == null)
        {
            return invalid(null);
        }
        if (either.isRight())
        {
            return valid(either.get());
        }
        E left = either.getLeft();
        return left == null
                ? invalid(null)
                : invalid(Collections.singletonList(left));
    }

    /**
     * Converts a {@link Try}: a success becomes valid, a failure becomes an invalid Validation holding its exception.
     * A null Try gives an invalid Validation without errors.
     */
    public static <T> Validation<Exception, T> fromTry(@Nullable Try<? extends T> t)
    {
        if (t == null)
        {
            return invalid(null);
        }
        return t.isSuccess()
                ? valid(t.get())
                : invalid(Collections.singletonList(t.getError()));
    }

    /**
     * Returns whether this is a {@link Valid}.
     */
    public abstract boolean isValid();

    /**
     * Returns the value of a {@link Valid}.
     *
     * @throws IllegalStateException if this is an {@link Invalid}
     */
    public abstract T get();

    /**
     * Returns the errors of an {@link Invalid}.
     *
     * @throws IllegalStateException if this is a {@link Valid}
     */
    public abstract List<E> getErrors();

    /**
     * Merges this Validation with another one:
     * <ul>
     *   <li>valid and valid: a valid Validation holding {@code mapperSuccess(this value, other value)}</li>
     *   <li>valid and invalid: the other one</li>
     *   <li>invalid and valid: this one</li>
     *   <li>invalid and invalid: an invalid Validation holding {@code mapperFailure(this errors, other errors)}</li>
     * </ul>
     * Anything thrown by the merging functions is relayed to the caller.
     *
     * @param other         the validation to merge with; when null, this Validation is returned
     * @param mapperFailure merges two error lists, required only when both are invalid
     * @param mapperSuccess merges two values, required only when both are valid
     * @return the merged validation
     */
    public Validation<E, T> ap(@Nullable Validation<E, T> other,
                               BiFunction<? super List<E>, ? super List<E>, ? extends List<? extends E>> mapperFailure,
                               BiFunction<? super T, ? super T, ? extends T> mapperSuccess)
    {
        if (other == null)
        {
            return this;
        }
        if (isValid())
        {
            if (other.isValid())
            {
                return valid(AssertUtil.notNull(mapperSuccess, "mapperSuccess must be not null")
                        .apply(get(), other.get()));
            }
            return other;
        }
        if (other.isValid())
        {
            return this;
        }
        return invalid(AssertUtil.notNull(mapperFailure, "mapperFailure must be not null")
                .apply(getErrors(), other.getErrors()));
    }

    /**
     * Merges with {@link #ap(Validation, BiFunction, BiFunction)}, keeping the second value when both are valid
     * and concatenating the errors when both are invalid.
     */
    public Validation<E, T> ap(@Nullable Validation<E, T> other)
    {
        return ap(other, Combinators.concat(), Combinators.returnLast());
    }

    /**
     * Returns true for an {@link Invalid}, or a {@link Valid} holding null.
     */
    public boolean isEmpty()
    {
        return !isValid() || get() == null;
    }

    /**
     * Keeps a {@link Valid} whose value matches the predicate.
     * <ul>
     *   <li>invalid: returned unchanged, the predicate is not evaluated</li>
     *   <li>null predicate: this Validation is returned</li>
     *   <li>value matching the predicate: this Validation is returned</li>
     *   <li>otherwise: null, there is no resulting Validation</li>
     * </ul>
     *
     * @see #filterOptional(Predicate)
     */
    @Nullable
    public Validation<E, T> filter(@Nullable Predicate<? super T> predicate)
    {
        if (!isValid() || predicate == null)
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
    public Optional<Validation<E, T>> filterOptional(@Nullable Predicate<? super T> predicate)
    {
        return Optional.ofNullable(filter(predicate));
    }

    /**
     * Keeps a {@link Valid} whose value matches the predicate, otherwise turns it into an {@link Invalid}
     * holding the single error built by {@code errorMapper} from the value.
     * An {@link Invalid}, or a null predicate, leaves this Validation unchanged.
     *
     * @throws IllegalArgumentException if the value does not match and {@code errorMapper} is null
     */
    public Validation<E, T> filterOrElse(@Nullable Predicate<? super T> predicate, Function<? super T, ? extends E> errorMapper)
    {
        if (!isValid() || predicate == null || predicate.test(get()))
        {
            return this;
        }
        AssertUtil.notNull(errorMapper, "errorMapper must be not null");
        return invalid(Collections.singletonList(errorMapper.apply(get())));
    }

    /**
     * Applies the function to the value of a {@link Valid}; an {@link Invalid} keeps its errors.
     */
    public <U> Validation<E, U> map(Function<? super T, ? extends U> mapper)
    {
        return fold(
                (List<E> errors) -> invalid(errors),
                (T t) -> valid(AssertUtil.notNull(mapper, "mapper must be not null").apply(t))
        );
    }

    /**
     * Applies the function to the whole error list of an {@link Invalid}; a {@link Valid} keeps its value.
     */
    public <U> Validation<U, T> mapInvalid(Function<? super List<E>, ? extends List<? extends U>> mapper)
    {
        return fold(
                (List<E> errors) -> invalid(AssertUtil.notNull(mapper, "mapper must be not null").apply(errors)),
                (T t) -> valid(t)
        );
    }

    /**
     * Produce a Validation from the value of a {@link Valid}, or propagate the errors of an {@link Invalid}.
     */
    public <U> Validation<E, U> flatMap(Function<? super T, ? extends Validation<E, ? extends U>> mapper)
    {
        return fold(
                (List<E> errors) -> invalid(errors),
                (T t) -> Validation.<E, U>cast(AssertUtil.notNull(mapper, "mapper must be not null").apply(t))
        );
    }

    /**
     * Returns an {@link Either} holding the errors on the left or the value on the right.
     */
    public Either<List<E>, T> toEither()
    {
        return fold(
                (List<E> errors) -> Either.left(errors),
                (T t) -> Either.right(t)
        );
    }

    /**
     * Returns an {@link Optional} of the value; empty when {@link #isEmpty()}.
     */
    public Optional<T> toOptional()
    {
        return isEmpty()
                ? Optional.empty()
                : Optional.of(get());
    }

    static <E, T> Validation<E, T> cast(Validation<E, ? extends T> validation)
    {
        return validation.fold(
                (List<E> errors) -> invalid(errors),
                (T t) -> valid(t)
        );
    }

    /**
     * The class representing a valid value.
     */
    static class Valid<E, T> extends Validation<E, T>
    {
        final T value;

        Valid(T value)
        {
            this.value = value;
        }

        @Override
        public <U> U fold(Function<? super List<E>, ? extends U> onInvalid, Function<? super T, ? extends U> onValid)
        {
            return onValid.apply(value);
        }

        @Override
        public boolean isValid()
        {
            return true;
        }

        @Override
        public T get()
        {
            return value;
        }

        @Override
        public List<E> getErrors()
        {
            throw new IllegalStateException("Is not possible to get the errors of a 'Valid' Validation");
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(Valid.class, value);
        }

        @Override
        public boolean equals(Object o)
        {
            if (o instanceof Valid)
            {
                Valid<?, ?> v = (Valid<?, ?>) o;
                return Objects.equals(value, v.value);
            }
            return false;
        }

        @Override
        public String toString()
        {
            return "Validation.valid(" + value + ')';
        }
    }

    /**
     * The class representing a list of errors.
     */
    static class Invalid<E, T> extends Validation<E, T>
    {
        final List<E> errors;

        Invalid(List<E> errors)
        {
            this.errors = errors;
        }

        @Override
        public <U> U fold(Function<? super List<E>, ? extends U> onInvalid, Function<? super T, ? extends U> onValid)
        {
            return onInvalid.apply(errors);
        }

        @Override
        public boolean isValid()
        {
            return false;
        }

        @Override
        public T get()
        {
            throw new IllegalStateException("Is not possible to get the value of an 'Invalid' Validation");
        }

        @Override
        public List<E> getErrors()
        {
            return errors;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(Invalid.class, errors);
        }

        @Override
        public boolean equals(Object o)
        {
            if (o instanceof Invalid)
            {
                Invalid<?, ?> i = (Invalid<?, ?>) o;
                return errors.equals(i.errors);
            }
            return false;
        }

        @Override
        public String toString()
        {
            return "Validation.invalid(" + errors + ')';
        }
    }
}
