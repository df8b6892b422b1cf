package com.reelhub.discovery.api.dto;

/**
 * Page window over a result list. Field names stay camelCase on the wire for existing clients.
 */
public class Pagination {
    private int page;
    private int limit;
    private int total;

    private int totalPages;
    private boolean hasMore;

    public Pagination() {
    }

    public Pagination(int page, int limit, int total) {
        this.page = page;
        this.limit = limit;
        this.total = total;
        this.totalPages = limit <= 0 ? 0 : (int) Math.ceil((double) total / limit);
        this.hasMore = page < totalPages;
    }

    public static Pagination empty(int limit) {
        return new Pagination(1, limit, 0);
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }

    public boolean isHasMore() {
        return hasMore;
    }

    public void setHasMore(boolean hasMore) {
        this.hasMore = hasMore;
    }
}
