package cex.spot.matching.strategy;

/**
 * Callback invoked once per fill, before the fill is committed to the in-memory book.
 * Throwing aborts the matching loop and rolls back the in-memory changes of that fill.
 */
@FunctionalInterface
public interface FillHandler {

    void onFill(Fill fill);
}
