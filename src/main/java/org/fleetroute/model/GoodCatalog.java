package org.fleetroute.model;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, immutable set of good types tracked independently per point and vehicle.
 *
 * <p>Every amount mapping created through the catalog carries all catalog goods in
 * catalog order, so load and demand snapshots are directly comparable.</p>
 */
public final class GoodCatalog {
    public static final String ORANGES = "oranges";
    public static final String URANIUM = "uranium";
    public static final String TUNA = "tuna";

    private static final GoodCatalog DEFAULT = new GoodCatalog(List.of(ORANGES, URANIUM, TUNA));

    private final List<String> goods;
    private final Set<String> lookup;

    private GoodCatalog(List<String> goods) {
        Objects.requireNonNull(goods, "goods");
        if (goods.isEmpty()) {
            throw new IllegalArgumentException("good catalog must contain at least one good type");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String good : goods) {
            if (good == null || good.isBlank()) {
                throw new IllegalArgumentException("good type must be non-blank");
            }
            if (!unique.add(good)) {
                throw new IllegalArgumentException("duplicate good type: " + good);
            }
        }
        this.goods = List.copyOf(goods);
        this.lookup = Set.copyOf(unique);
    }

    /**
     * Returns the built-in catalog: oranges, uranium, tuna.
     */
    public static GoodCatalog defaultCatalog() {
        return DEFAULT;
    }

    /**
     * Creates a catalog from explicit good names, preserving order.
     */
    public static GoodCatalog of(String... goods) {
        return new GoodCatalog(List.of(goods));
    }

    public List<String> goods() {
        return goods;
    }

    public int size() {
        return goods.size();
    }

    public boolean contains(String good) {
        return lookup.contains(good);
    }

    /**
     * Creates a mutable mapping with every catalog good set to zero.
     */
    public Object2IntLinkedOpenHashMap<String> zeroes() {
        Object2IntLinkedOpenHashMap<String> amounts = new Object2IntLinkedOpenHashMap<>(goods.size());
        for (String good : goods) {
            amounts.put(good, 0);
        }
        return amounts;
    }

    /**
     * Creates a mutable mapping holding {@code amount} for one good and zero elsewhere.
     */
    public Object2IntLinkedOpenHashMap<String> single(String good, int amount) {
        Object2IntLinkedOpenHashMap<String> amounts = zeroes();
        amounts.put(requireGood(good), amount);
        return amounts;
    }

    /**
     * Normalizes a sparse amount map into a full catalog-ordered copy.
     *
     * @throws IllegalArgumentException when a key is not a catalog good.
     */
    public Object2IntLinkedOpenHashMap<String> normalize(Map<String, Integer> sparse) {
        Object2IntLinkedOpenHashMap<String> amounts = zeroes();
        if (sparse == null) {
            return amounts;
        }
        for (Map.Entry<String, Integer> entry : sparse.entrySet()) {
            Integer value = entry.getValue();
            amounts.put(requireGood(entry.getKey()), value == null ? 0 : value);
        }
        return amounts;
    }

    /**
     * Returns an unmodifiable copy of a catalog-ordered amount mapping.
     */
    public static Object2IntMap<String> snapshot(Object2IntLinkedOpenHashMap<String> amounts) {
        return Object2IntMaps.unmodifiable(new Object2IntLinkedOpenHashMap<>(amounts));
    }

    /**
     * Validates that {@code good} belongs to the catalog.
     */
    public String requireGood(String good) {
        if (!lookup.contains(good)) {
            throw new IllegalArgumentException("unknown good type: " + good + " (catalog " + goods + ")");
        }
        return good;
    }

    @Override
    public String toString() {
        return "GoodCatalog" + goods;
    }
}
