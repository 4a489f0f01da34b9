package com.ecommerce.user.modules.account.application;

/**
 * Page/page-size pair after defaults and clamping: non-positive page becomes 1, non-positive size becomes 20,
 * size is capped at 100.
 */
public record PageWindow(int page, int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    public static PageWindow of(Integer page, Integer pageSize) {
        int effectivePage = page == null || page <= 0 ? 1 : page;
        int effectiveSize = pageSize == null || pageSize <= 0 ? DEFAULT_PAGE_SIZE : Math.min(pageSize, MAX_PAGE_SIZE);
        return new PageWindow(effectivePage, effectiveSize);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
