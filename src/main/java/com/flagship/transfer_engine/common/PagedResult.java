package com.flagship.transfer_engine.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing plus the total number of matching rows.
 */
@Value
public class PagedResult<T> {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;

    @JsonProperty("items")
    List<T> items;

    @JsonProperty("total")
    long total;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    public <R> PagedResult<R> map(Function<T, R> mapper) {
        return new PagedResult<>(items.stream().map(mapper).toList(), total, page, size);
    }

    public static int normalizePage(Integer page) {
        return page == null || page < 0 ? 0 : page;
    }

    public static int normalizeSize(Integer size) {
        if (size == null || size <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(size, MAX_PAGE_SIZE);
    }
}
