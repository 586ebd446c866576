package com.digitalgroup.scheduler.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Standard REST pagination response wrapper.
 *
 * @param <T> The type of items in the data list
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PagedResponse<T> {

    private List<T> data;
    private Meta meta;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        private long totalItems;
        private int page;
        private int pageSize;
        private int totalPages;
    }

    /**
     * Slices a fully loaded list into the requested 1-based page.
     */
    public static <T> PagedResponse<T> paginate(List<T> all, int page, int pageSize) {
        long offset = ((long) Math.max(page, 1) - 1) * pageSize;
        int from = (int) Math.min(offset, all.size());
        int to = (int) Math.min((long) from + pageSize, all.size());
        return of(all.subList(from, to), all.size(), page, pageSize);
    }

    /**
     * Create a PagedResponse with explicit pagination info
     */
    public static <T> PagedResponse<T> of(List<T> data, long totalItems, int page, int pageSize) {
        int totalPages = (int) Math.ceil((double) totalItems / pageSize);
        return PagedResponse.<T>builder()
                .data(data)
                .meta(Meta.builder()
                        .totalItems(totalItems)
                        .page(page)
                        .pageSize(pageSize)
                        .totalPages(totalPages)
                        .build())
                .build();
    }
}
