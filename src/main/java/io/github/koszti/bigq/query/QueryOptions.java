package io.github.koszti.bigq.query;

import io.github.koszti.bigq.query.exception.QueryArgumentException;

/**
 * Where to start reading a result set and how many rows to fetch per page.
 *
 * @param offset   first row to return, 0 for the beginning
 * @param pageSize rows per page, 0 lets BigQuery choose
 */
public record QueryOptions(long offset, long pageSize)
{
    public static final QueryOptions DEFAULTS = new QueryOptions(0, 0);

    public QueryOptions {
        if (offset < 0) {
            throw new QueryArgumentException("offset must not be negative: " + offset);
        }
        if (pageSize < 0) {
            throw new QueryArgumentException("pageSize must not be negative: " + pageSize);
        }
    }

    /**
     * Reads positional arguments {@code [offset[, pageSize]]}.
     */
    public static QueryOptions fromArgs(long... args) {
        if (args == null) {
            return DEFAULTS;
        }
        switch (args.length) {
            case 0:
                return DEFAULTS;
            case 1:
                return new QueryOptions(args[0], 0);
            case 2:
                return new QueryOptions(args[0], args[1]);
            default:
                throw new QueryArgumentException("too many arguments given to query: " + args.length);
        }
    }
}
