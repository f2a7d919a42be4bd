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

package unimelb.functional.function;

import org.jetbrains.annotations.Nullable;
import unimelb.functional.algebraic.Optional;
import unimelb.functional.combinator.Combinators;
import unimelb.functional.util.AssertUtil;

import java.util.AbstractMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A unary function defined only on the inputs accepted by its verifier, its domain.
 * <p>
 * {@link #apply} evaluates the mapper unconditionally and does not guarantee any failure outside the domain:
 * check {@link #isDefinedAt} first, or use {@link #applyOrElse} or {@link #lift}.
 * <p>
 * Partial functions are immutable. Composition ({@link #andThen}, {@link #compose}, {@link #orElse})
 * always builds a new partial function and never modifies its operands.
 * <h3>Examples:</h3>
 * <pre> {@code
 * PartialFunction<Integer, Integer> half = PartialFunction.of(i -> i % 2 == 0, i -> i / 2);
 *
 * half.isDefinedAt(4) == true
 * half.isDefinedAt(3) == false
 * half.andThen(half).isDefinedAt(4) == true   // 4 -> 2 -> 1
 * half.andThen(half).isDefinedAt(6) == false  // 6 -> 3, outside the domain
 * half.lift().apply(3) == Optional.empty()
 * } </pre>
 *
 * @param <T> the type of the input
 * @param <R> the type of the result
 */
public final class PartialFunction<T, R> implements Function<T, R>
{
    private final Predicate<T> verifier;
    private final Function<T, R> mapper;

    private PartialFunction(Predicate<T> verifier, Function<T, R> mapper)
    {
        this.verifier = verifier;
        this.mapper = mapper;
    }

    /**
     * Builds a partial function from its domain test and its mapping.
     *
     * @param verifier the domain test; when null every input belongs to the domain
     * @param mapper   the mapping applied to inputs of the domain
     * @param <T>      the type of the input
     * @param <R>      the type of the result
     * @return the partial function
     * @throws IllegalArgumentException if {@code mapper} is null
     */
    public static <T, R> PartialFunction<T, R> of(@Nullable Predicate<? super T> verifier,
                                                  Function<? super T, ? extends R> mapper)
    {
        AssertUtil.notNull(mapper, "mapper must be not null");
        Predicate<T> finalVerifier = verifier == null
                ? Combinators.alwaysTrue()
                : verifier::test;
        return new PartialFunction<>(finalVerifier, mapper::apply);
    }

    /**
     * Builds a partial function mapping every input of the domain to a key/value entry.
     *
     * @param verifier    the domain test; when null every input belongs to the domain
     * @param keyMapper   computes the key of the entry
     * @param valueMapper computes the value of the entry
     * @throws IllegalArgumentException if {@code keyMapper} or {@code valueMapper} is null
     */
    public static <T, K, V> PartialFunction<T, Map.Entry<K, V>> ofToEntry(@Nullable Predicate<? super T> verifier,
                                                                          Function<? super T, ? extends K> keyMapper,
                                                                          Function<? super T, ? extends V> valueMapper)
    {
        AssertUtil.notNull(keyMapper, "keyMapper must be not null");
        AssertUtil.notNull(valueMapper, "valueMapper must be not null");
        return PartialFunction.<T, Map.Entry<K, V>>of(
                verifier,
                (T t) -> new AbstractMap.SimpleImmutableEntry<K, V>(keyMapper.apply(t), valueMapper.apply(t))
        );
    }

    /**
     * Returns the total partial function mapping every input to itself.
     */
    public static <T> PartialFunction<T, T> identity()
    {
        return new PartialFunction<>(Combinators.alwaysTrue(), Combinators::id);
    }

    public Predicate<T> getVerifier()
    {
        return verifier;
    }

    public Function<T, R> getMapper()
    {
        return mapper;
    }

    /**
     * Returns whether the input belongs to the domain.
     */
    public boolean isDefinedAt(T t)
    {
        return verifier.test(t);
    }

    /**
     * Applies the mapper, whether or not the input belongs to the domain.
     */
    @Override
    public R apply(T t)
    {
        return mapper.apply(t);
    }

    /**
     * Applies this partial function if the input belongs to its domain, otherwise the default function.
     *
     * @param t               the input
     * @param defaultFunction the function applied outside the domain
     * @return the result of the applied function
     * @throws IllegalArgumentException if the input is outside the domain and {@code defaultFunction} is null
     */
    public R applyOrElse(T t, Function<? super T, ? extends R> defaultFunction)
    {
        if (isDefinedAt(t))
        {
            return apply(t);
        }
        return AssertUtil.notNull(defaultFunction, "defaultFunction must be not null").apply(t);
    }

    /**
     * Returns a partial function with the same domain, whose results are given to {@code after}.
     *
     * @throws IllegalArgumentException if {@code after} is null
     */
    @Override
    public <V> PartialFunction<T, V> andThen(Function<? super R, ? extends V> after)
    {
        AssertUtil.notNull(after, "after must be not null");
        return new PartialFunction<>(
                verifier,
                (T t) -> after.apply(apply(t))
        );
    }

    /**
     * Returns a partial function whose results are given to {@code after}.
     * Its domain holds the inputs of this domain whose result belongs to the domain of {@code after}.
     *
     * @throws IllegalArgumentException if {@code after} is null
     */
    public <V> PartialFunction<T, V> andThen(PartialFunction<? super R, ? extends V> after)
    {
        AssertUtil.notNull(after, "after must be not null");
        return new PartialFunction<>(
                (T t) -> isDefinedAt(t) && after.isDefinedAt(apply(t)),
                (T t) -> after.apply(apply(t))
        );
    }

    /**
     * Returns a partial function applying {@code before} first.
     * Its domain holds the inputs whose image through {@code before} belongs to this domain.
     *
     * @throws IllegalArgumentException if {@code before} is null
     */
    @Override
    public <V> PartialFunction<V, R> compose(Function<? super V, ? extends T> before)
    {
        AssertUtil.notNull(before, "before must be not null");
        return new PartialFunction<>(
                (V v) -> isDefinedAt(before.apply(v)),
                (V v) -> apply(before.apply(v))
        );
    }

    /**
     * Returns a partial function applying {@code before} first.
     * Its domain holds the inputs of the domain of {@code before} whose result belongs to this domain.
     *
     * @throws IllegalArgumentException if {@code before} is null
     */
    public <V> PartialFunction<V, R> compose(PartialFunction<? super V, ? extends T> before)
    {
        AssertUtil.notNull(before, "before must be not null");
        return new PartialFunction<>(
                (V v) -> before.isDefinedAt(v) && isDefinedAt(before.apply(v)),
                (V v) -> apply(before.apply(v))
        );
    }

    /**
     * Returns a partial function defined on the union of both domains.
     * Where this partial function is defined it is applied, elsewhere {@code defaultPartialFunction} is.
     *
     * @param defaultPartialFunction the fallback; when null the result behaves as this partial function
     * @return the combined partial function
     */
    public PartialFunction<T, R> orElse(@Nullable PartialFunction<T, ? extends R> defaultPartialFunction)
    {
        if (defaultPartialFunction == null)
        {
            return new PartialFunction<>(verifier, mapper);
        }
        return new PartialFunction<>(
                verifier.or(defaultPartialFunction::isDefinedAt),
                (T t) -> applyOrElse(t, defaultPartialFunction)
        );
    }

    /**
     * Returns a total function giving the result wrapped in an {@link Optional},
     * empty for inputs outside the domain or null results.
     */
    public Function<T, Optional<R>> lift()
    {
        return (T t) -> isDefinedAt(t)
                ? Optional.ofNullable(apply(t))
                : Optional.empty();
    }
}
