package com.ryuqq.registry.adapter.inmemory.index;

import com.ryuqq.registry.core.model.CatalogMatch;
import com.ryuqq.registry.core.model.TicketId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Value catalog: resolved value → one or many ticket ids.
 *
 * <p>A bucket holds a single id until a second ticket with an equal value is assigned; it then
 * becomes a list in insertion order. Removing ids collapses a list back to a single id when one
 * remains and drops the bucket when none remain, so a value with zero ids is never present.</p>
 *
 * <p>Values are compared with {@code equals}/{@code hashCode}; {@code null} is a valid value.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class ValueCatalog {

    private final Map<Object, Bucket> catalog = new HashMap<>();

    /**
     * Adds {@code id} to the bucket for {@code value}. Re-assigning an id already in the bucket is a no-op.
     *
     * @param value resolved value (null allowed)
     * @param id the ticket id
     */
    public void assign(Object value, TicketId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Bucket bucket = catalog.get(value);
        if (bucket == null) {
            catalog.put(value, new Bucket(id));
        } else {
            bucket.add(id);
        }
    }

    /**
     * Removes {@code id} from the bucket for {@code value}. Unknown pairs are ignored.
     *
     * @param value resolved value (null allowed)
     * @param id the ticket id
     */
    public void unassign(Object value, TicketId id) {
        Bucket bucket = catalog.get(value);
        if (bucket == null || id == null) {
            return;
        }
        bucket.remove(id);
        if (bucket.isEmpty()) {
            catalog.remove(value);
        }
    }

    /**
     * @param value resolved value (null allowed)
     * @return Single or Many match, or null when no ticket carries the value
     */
    public CatalogMatch browse(Object value) {
        Bucket bucket = catalog.get(value);
        return bucket == null ? null : bucket.toMatch();
    }

    /**
     * @return number of distinct values catalogued
     */
    public int size() {
        return catalog.size();
    }

    public void clear() {
        catalog.clear();
    }

    /**
     * Single id, upgraded to a list on the first collision.
     */
    private static final class Bucket {

        private TicketId single;
        private List<TicketId> many;

        Bucket(TicketId id) {
            this.single = id;
        }

        void add(TicketId id) {
            if (many != null) {
                if (!many.contains(id)) {
                    many.add(id);
                }
            } else if (single == null) {
                single = id;
            } else if (!single.equals(id)) {
                many = new ArrayList<>(4);
                many.add(single);
                many.add(id);
                single = null;
            }
        }

        void remove(TicketId id) {
            if (many != null) {
                many.remove(id);
                if (many.size() == 1) {
                    single = many.get(0);
                    many = null;
                }
            } else if (id.equals(single)) {
                single = null;
            }
        }

        boolean isEmpty() {
            return single == null && (many == null || many.isEmpty());
        }

        CatalogMatch toMatch() {
            return many != null ? new CatalogMatch.Many(many) : new CatalogMatch.Single(single);
        }
    }
}
