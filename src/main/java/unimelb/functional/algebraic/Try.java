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

import unimelb.functional.algebraic.utils.Voids;
import unimelb.functional.combinator.Combinators;
import unimelb.functional.config.FunctionalConfiguration;
import unimelb.functional.throwing.ThrowingBiFunction;
import unimelb.functional.throwing.ThrowingConsumer;
import unimelb.functional.throwing.ThrowingFunction;
import unimelb.functional.throwing.ThrowingFunction3;
import unimelb.functional.throwing.ThrowingFunction4;
import unimelb.functional.throwing.ThrowingFunction5;
import unimelb.functional.throwing.ThrowingRunnable;
import unimelb.functional.throwing.ThrowingSupplier;
import unimelb.functional.util.AssertUtil;
import unimelb.functional.util.Throwables;

import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A Try is a container representing the outcome of a computation that may throw an exception:
 * either a success holding the computed value, or a failure holding the thrown exception.
 * It provides pattern matching to handle control flow when extracting the data,
 * and operations to transform or sequence outcomes without explicit exception handling at every step.
 * <p>
 * <p>A success may hold {@code null}; such a success is "empty" but is still distinct from a failure.
 * A failure always holds a non-null exception.
 * <p>
 * <p>Conceptually {@link #get} is the inverse of {@link #ofFunction0}:
 * {@code t <==> ofFunction0(t::get)}<br>
 * {@code f.get() <==> ofFunction0(f).get()}<br>
 *
 * @param <T> the value type in the case of success.
 * @author Zoey Hewll
 */
public final class Try<T> implements ThrowingSupplier<T, Exception>
{
    private static final Logger log = Logger.getLogger(Try.class.getName());

    /**
     * The Either type used internally to hold the alternative values.
     */
    private final Either<Exception, T> either;

    /**
     * Constructor.
     * Makes a Try from the given Either.
     *
     * @param either The Either value used to maintain internal structure.
     */
    private Try(Either<Exception, T> either)
    {
        this.either = either;
    }

    /**
     * Returns a successful Try containing the provided value, which may be null.
     *
     * @param value The value to contain
     * @param <T>   The type of the contained value
     * @return A successful Try
     */
    public static <T> Try<T> success(T value)
    {
        return new Try<>(Either.right(value));
    }

    /**
     * Returns a failed Try containing the provided exception.
     *
     * @param error The exception to contain
     * @param <T>   The unused value type
     * @return A failed Try
     * @throws IllegalArgumentException if the exception is null
     */
    public static <T> Try<T> failure(Exception error)
    {
        return new Try<>(Either.left(AssertUtil.notNull(error, "error must be not null")));
    }

    /**
     * Perform an operation which may throw, and encapsulate the outcome.<br>
     * If the operation succeeds, the Try will contain the returned value.<br>
     * If the operation fails, the Try will contain the thrown exception.
     * A throwable which is not an {@link Exception} is wrapped first, see {@link Throwables#normalize}.
     *
     * @param func the operation to perform
     * @param <T>  the type of value which may be returned
     * @return A Try representing the outcome of the operation.
     */
    public static <T> Try<T> ofFunction0(ThrowingSupplier<? extends T, ?> func)
    {
        AssertUtil.notNull(func, "func must be not null");
        try
        {
            return success(func.get());
        }
        catch (Throwable t)
        {
            return failureResultHandler(t);
        }
    }

    public static <T1, R> Try<R> ofFunction1(T1 t1,
                                             ThrowingFunction<? super T1, ? extends R, ?> func)
    {
        AssertUtil.notNull(func, "func must be not null");
        return ofFunction0(() -> func.apply(t1));
    }

    public static <T1, T2, R> Try<R> ofFunction2(T1 t1, T2 t2,
                                                 ThrowingBiFunction<? super T1, ? super T2, ? extends R, ?> func)
    {
        AssertUtil.notNull(func, "func must be not null");
        return ofFunction0(() -> func.apply(t1, t2));
    }

    public static <T1, T2, T3, R> Try<R> ofFunction3(T1 t1, T2 t2, T3 t3,
                                                     ThrowingFunction3<? super T1, ? super T2, ? super T3, ? extends R, ?> func)
    {
        AssertUtil.notNull(func, "func must be not null");
        return ofFunction0(() -> func.apply(t1, t2, t3));
    }

    public static <T1, T2, T3, T4, R> Try<R> ofFunction4(T1 t1, T2 t2, T3 t3, T4 t4,
                                                         ThrowingFunction4<? super T1, ? super T2, ? super T3, ? super T4, ? extends R, ?> func)
    {
        AssertUtil.notNull(func, "func must be not null");
        return ofFunction0(() -> func.apply(t1, t2, t3, t4));
    }

    public static <T1, T2, T3, T4, T5, R> Try<R> ofFunction5(T1 t1, T2 t2, T3 t3, T4 t4, T5 t5,
                                                             ThrowingFunction5<? super T1, ? super T2, ? super T3, ? super T4, ? super T5, ? extends R, ?> func)
    {
        AssertUtil.notNull(func, "func must be not null");
        return ofFunction0(() -> func.apply(t1, t2, t3, t4, t5));
    }

    /**
     * Perform an action which may throw, and encapsulate the outcome.
     * If the action succeeds, the Try will contain nothing (Void).
     *
     * @param action the action to perform
     * @return A Try representing the outcome of the action.
     */
    public static Try<Void> run(ThrowingRunnable<?> action)
    {
        AssertUtil.notNull(action, "action must be not null");
        return ofFunction0(Voids.convertUnsafe(action));
    }

    /**
     * Merges the given Trys from left to right with {@link #ap}.
     * Null elements are skipped.
     *
     * @param mapperFailure merges two exceptions when both sides are failures
     * @param mapperSuccess merges two values when both sides are successes
     * @param tries         the Trys to merge
     * @param <T>           the value type
     * @return the merged Try, or a success holding null if {@code tries} is null or empty
     */
    public static <T> Try<T> combine(BiFunction<? super Exception, ? super Exception, ? extends Exception> mapperFailure,
                                     BiFunction<? super T, ? super T, ? extends T> mapperSuccess,
                                     List<Try<T>> tries)
    {
        Try<T> result = null;
        for (Try<T> t : tries == null ? Collections.<Try<T>>emptyList() : tries)
        {
            result = result == null
                    ? t
                    : result.ap(t, mapperFailure, mapperSuccess);
        }
        return result == null
                ? success(null)
                : result;
    }

    /**
     * Evaluates the given suppliers in order, merging successes with {@code mapperSuccess},
     * and stops at the first failure, which is returned. Later suppliers are not invoked.
     *
     * @param mapperSuccess merges two successful values
     * @param suppliers     the computations to evaluate
     * @param <T>           the value type
     * @return the first failure, or the merged success; a success holding null if {@code suppliers} is null or empty.
     * Suppliers returning null are skipped.
     * @throws IllegalArgumentException if a supplier is null
     */
    public static <T> Try<T> combineGetFirstFailure(BiFunction<? super T, ? super T, ? extends T> mapperSuccess,
                                                    List<? extends Supplier<Try<T>>> suppliers)
    {
        if (suppliers == null || suppliers.isEmpty())
        {
            return success(null);
        }
        Try<T> result = null;
        for (Supplier<Try<T>> supplier : suppliers)
        {
            Try<T> current = AssertUtil.notNull(supplier, "suppliers must not contain null elements").get();
            if (current == null)
            {
                continue;
            }
            result = result == null
                    ? current
                    : result.ap(current, Combinators.returnFirst(), mapperSuccess);
            if (result.isFailure())
            {
                return result;
            }
        }
        return result == null
                ? success(null)
                : result;
    }

    private static <T> Try<T> failureResultHandler(Throwable t)
    {
        Exception error = Throwables.normalize(t);
        if (error instanceof InterruptedException)
        {
            // the interrupt is stored, the thread stays interrupted
            Thread.currentThread().interrupt();
        }
        if (FunctionalConfiguration.isLogCapturedFailures())
        {
            log.log(Level.FINE, "Captured failure: " + error, error);
        }
        return failure(error);
    }

    /**
     * Returns true if this is a success.
     */
    public boolean isSuccess()
    {
        return either.isRight();
    }

    /**
     * Returns true if this is a failure.
     */
    public boolean isFailure()
    {
        return either.isLeft();
    }

    /**
     * If this is a success, return its value.<br>
     * If it is a failure, re-raise the stored exception itself, undeclared even when it is checked.
     *
     * @return the contained value
     */
    @Override
    public T get()
    {
        return either.matchThen(
                (Exception e) -> Throwables.<T>sneakyThrow(e),
                (T v) -> v
        );
    }

    /**
     * Returns the stored exception of a failure.
     *
     * @return the contained exception
     * @throws IllegalStateException if this is a success
     */
    public Exception getError()
    {
        return either.matchThen(
                (Exception e) -> e,
                (T v) -> { throw new IllegalStateException("Is not possible to get the exception of a 'Success' Try"); }
        );
    }

    /**
     * Merges this Try with another one:
     * <ul>
     *   <li>success and success: a success holding {@code mapperSuccess(this value, other value)}</li>
     *   <li>success and failure: the other failure</li>
     *   <li>failure and success: this failure</li>
     *   <li>failure and failure: a failure holding {@code mapperFailure(this error, other error)}</li>
     * </ul>
     * The merging functions are invoked inside a protected region: anything they throw becomes a failure.
     *
     * @param other         the Try to merge with; when null, this Try is returned
     * @param mapperFailure merges two exceptions
     * @param mapperSuccess merges two values
     * @return the merged Try
     */
    public Try<T> ap(Try<T> other,
                     BiFunction<? super Exception, ? super Exception, ? extends Exception> mapperFailure,
                     BiFunction<? super T, ? super T, ? extends T> mapperSuccess)
    {
        if (other == null)
        {
            return this;
        }
        if (isSuccess())
        {
            if (other.isSuccess())
            {
                AssertUtil.notNull(mapperSuccess, "mapperSuccess must be not null");
                return ofFunction2(get(), other.get(), mapperSuccess::apply);
            }
            return failure(other.getError());
        }
        if (other.isSuccess())
        {
            return failure(getError());
        }
        AssertUtil.notNull(mapperFailure, "mapperFailure must be not null");
        Try<Exception> merged = ofFunction2(getError(), other.getError(), mapperFailure::apply);
        return merged.flatMap((Exception e) -> Try.<T>failure(e));
    }

    /**
     * Applies {@code mapperSuccess} to the value of a success, or {@code mapperFailure} to the exception of a failure.
     * If {@code mapperSuccess} throws, the thrown exception is given to {@code mapperFailure} instead.
     *
     * @param mapperFailure the function to apply to an exception
     * @param mapperSuccess the function to apply to a value
     * @param <U>           the result type
     * @return the result of the applied function
     */
    public <U> U fold(Function<? super Exception, ? extends U> mapperFailure,
                      ThrowingFunction<? super T, ? extends U, ?> mapperSuccess)
    {
        AssertUtil.notNull(mapperFailure, "mapperFailure must be not null");
        Try<U> outcome;
        if (isSuccess())
        {
            AssertUtil.notNull(mapperSuccess, "mapperSuccess must be not null");
            outcome = ofFunction1(get(), mapperSuccess);
        }
        else
        {
            outcome = failure(getError());
        }
        return outcome.either.matchThen(
                mapperFailure,
                (U u) -> u
        );
    }

    /**
     * Returns the value of a success, or the given default for a failure.
     *
     * @param defaultValue the value to use for a failure
     * @return the contained value or {@code defaultValue}
     */
    public T getOrElse(T defaultValue)
    {
        return either.fromRight(defaultValue);
    }

    /**
     * As {@link #getOrElse}, wrapping the chosen value into an {@link Optional}; null becomes empty.
     */
    public Optional<T> getOrElseOptional(T defaultValue)
    {
        return Optional.ofNullable(getOrElse(defaultValue));
    }

    /**
     * Returns true for a failure, or a success holding null.
     */
    public boolean isEmpty()
    {
        return isFailure() || get() == null;
    }

    /**
     * Apply the function to the value of a success, and return the outcome.
     * A failure is propagated without invoking the function.
     *
     * @param mapper the function to apply
     * @param <U>    the return type of the function
     * @return the mapped Try
     */
    public <U> Try<U> map(ThrowingFunction<? super T, ? extends U, ?> mapper)
    {
        if (isFailure())
        {
            return failure(getError());
        }
        AssertUtil.notNull(mapper, "mapper must be not null");
        return ofFunction1(get(), mapper);
    }

    /**
     * Produce a Try of another type from the value of a success, or propagate the failure.
     * Equivalent to haskell's Monadic bind {@code (this >>=)}.
     *
     * @param mapper the function to bind
     * @param <U>    the value type of the returned Try
     * @return the result of the bound computation
     */
    public <U> Try<U> flatMap(ThrowingFunction<? super T, ? extends Try<? extends U>, ?> mapper)
    {
        if (isFailure())
        {
            return failure(getError());
        }
        AssertUtil.notNull(mapper, "mapper must be not null");
        Try<Try<? extends U>> nested = ofFunction1(get(), mapper);
        return join(nested);
    }

    /**
     * Apply the function to the exception of a failure. A success is returned unchanged.
     *
     * @param mapper the function to apply
     * @return the mapped Try
     */
    public Try<T> mapFailure(ThrowingFunction<? super Exception, ? extends Exception, ?> mapper)
    {
        if (isSuccess())
        {
            return this;
        }
        AssertUtil.notNull(mapper, "mapper must be not null");
        Try<Exception> mapped = ofFunction1(getError(), mapper);
        return mapped.flatMap((Exception e) -> Try.<T>failure(e));
    }

    /**
     * Turns a failure into a success using the value computed from its exception.
     *
     * @param mapper the function computing a value from the exception
     * @return a success, or a failure if {@code mapper} throws
     */
    public Try<T> recover(ThrowingFunction<? super Exception, ? extends T, ?> mapper)
    {
        if (isSuccess())
        {
            return this;
        }
        AssertUtil.notNull(mapper, "mapper must be not null");
        return ofFunction1(getError(), mapper);
    }

    /**
     * Replaces a failure with the Try computed from its exception.
     *
     * @param mapper the function computing a Try from the exception
     * @return the computed Try, or a failure if {@code mapper} throws
     */
    public Try<T> recoverWith(ThrowingFunction<? super Exception, ? extends Try<? extends T>, ?> mapper)
    {
        if (isSuccess())
        {
            return this;
        }
        AssertUtil.notNull(mapper, "mapper must be not null");
        Try<Try<? extends T>> nested = ofFunction1(getError(), mapper);
        return join(nested);
    }

    /**
     * Maps a success with {@code mapperSuccess} and recovers a failure with {@code mapperFailure}.
     * Only the function matching the variant is required.
     */
    public <U> Try<U> transform(ThrowingFunction<? super Exception, ? extends U, ?> mapperFailure,
                                ThrowingFunction<? super T, ? extends U, ?> mapperSuccess)
    {
        if (isSuccess())
        {
            AssertUtil.notNull(mapperSuccess, "mapperSuccess must be not null");
            return ofFunction1(get(), mapperSuccess);
        }
        AssertUtil.notNull(mapperFailure, "mapperFailure must be not null");
        return ofFunction1(getError(), mapperFailure);
    }

    /**
     * Keeps a success whose value matches the predicate; otherwise the success becomes a failure holding a
     * {@link NoSuchElementException}. A failure is returned unchanged.
     *
     * @param predicate the condition the value must meet
     * @return the filtered Try
     */
    public Try<T> filter(Predicate<? super T> predicate)
    {
        if (isFailure())
        {
            return this;
        }
        AssertUtil.notNull(predicate, "predicate must be not null");
        return ofFunction1(get(), predicate::test)
                .flatMap((Boolean matches) -> matches
                        ? this
                        : Try.<T>failure(new NoSuchElementException("Predicate does not hold for " + get())));
    }

    /**
     * Returns this Try if it is a success, otherwise the given one.
     */
    public Try<T> orElse(Try<T> other)
    {
        return isSuccess()
                ? this
                : AssertUtil.notNull(other, "other must be not null");
    }

    /**
     * Returns this Try if it is a success, otherwise the Try computed by the supplier.
     * The supplier is only invoked for a failure; anything it throws becomes a failure.
     */
    public Try<T> orElse(Supplier<? extends Try<? extends T>> other)
    {
        if (isSuccess())
        {
            return this;
        }
        AssertUtil.notNull(other, "other must be not null");
        Try<Try<? extends T>> nested = ofFunction0(other::get);
        return join(nested);
    }

    /**
     * Performs the action on the value of a success,
     * returning {@code this} if the action completes, otherwise the failure it produced.
     *
     * @param action the action to perform
     * @return this Try, or a failure
     */
    public Try<T> peek(ThrowingConsumer<? super T, ?> action)
    {
        if (isFailure())
        {
            return this;
        }
        AssertUtil.notNull(action, "action must be not null");
        Try<Void> outcome = ofFunction1(get(), Voids.convertUnsafe(action));
        return outcome.isSuccess()
                ? this
                : failure(outcome.getError());
    }

    /**
     * Returns an {@link Either} holding the exception on the left or the value on the right.
     */
    public Either<Exception, T> toEither()
    {
        return either;
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

    /**
     * Converts to a {@link Validation}.
     *
     * @see Validation#fromTry(Try)
     */
    public Validation<Exception, T> toValidation()
    {
        return Validation.fromTry(this);
    }

    /**
     * Converts a nested Try (aka Try of a Try) into a single Try.
     */
    static <T> Try<T> join(Try<? extends Try<? extends T>> t)
    {
        if (t.isFailure())
        {
            return failure(t.getError());
        }
        Try<? extends T> inner = t.get();
        if (inner == null)
        {
            return failure(new IllegalArgumentException("The computed Try must be not null"));
        }
        return inner.isSuccess()
                ? success(inner.get())
                : failure(inner.getError());
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(Try.class, either);
    }

    @Override
    public boolean equals(Object o)
    {
        if (o instanceof Try)
        {
            Try<?> t = (Try<?>) o;
            return either.equals(t.either);
        }
        return false;
    }

    @Override
    public String toString()
    {
        return either.matchThen(
                e -> "Try.failure(" + e + ')',
                v -> "Try.success(" + v + ')'
        );
    }
}
