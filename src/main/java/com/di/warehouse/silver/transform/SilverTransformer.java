package com.di.warehouse.silver.transform;

import com.di.warehouse.silver.batch.BatchContext;

import java.util.List;

/**
 * Pure Bronze-to-Silver rule set for one table. Implementations never touch the database and
 * never fail on bad row values: invalid inputs become nulls or N/A.
 *
 * @param <I> Bronze row type
 * @param <O> Silver row type
 */
public interface SilverTransformer<I, O> {

    /**
     * @param rows Bronze rows in whatever order the database returns them; output must not depend on it
     * @param context batch context (processing time)
     */
    List<O> transform(List<I> rows, BatchContext context);
}
