package com.digitalgroup.scheduler.web.dto;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PagedResponseTest {

    @Test
    void paginate_MiddlePage_ReturnsSlice() {
        PagedResponse<String> response = PagedResponse.paginate(List.of("a", "b", "c", "d", "e"), 2, 2);

        assertEquals(List.of("c", "d"), response.getData());
        assertEquals(5, response.getMeta().getTotalItems());
        assertEquals(3, response.getMeta().getTotalPages());
    }

    @Test
    void paginate_PageBeyondLastPage_ReturnsEmptyData() {
        PagedResponse<String> response = PagedResponse.paginate(List.of("a"), 3, 20);

        assertTrue(response.getData().isEmpty());
        assertEquals(1, response.getMeta().getTotalItems());
    }

    @Test
    void paginate_HugePageNumber_ReturnsEmptyDataInsteadOfOverflowing() {
        PagedResponse<String> response = PagedResponse.paginate(List.of("a"), Integer.MAX_VALUE, 20);

        assertTrue(response.getData().isEmpty());
        assertEquals(1, response.getMeta().getTotalItems());
        assertEquals(Integer.MAX_VALUE, response.getMeta().getPage());
    }
}
