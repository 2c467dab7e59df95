package com.bookshelf.backend.modules.book.presentation.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

class BookPageResponseTest {

    @Test
    void emptyPageHasNoRange() {
        BookPageResponse response = BookPageResponse.from(new PageImpl<>(List.of(), PageRequest.of(0, 10), 0), 1);

        assertThat(response.data()).isEmpty();
        assertThat(response.meta().from()).isNull();
        assertThat(response.meta().to()).isNull();
        assertThat(response.meta().lastPage()).isEqualTo(1);
        assertThat(response.meta().total()).isZero();
    }

    @Test
    void partialLastPageReportsItemRange() {
        List<BookResponse> items = IntStream.rangeClosed(21, 23)
                .mapToObj(i -> new BookResponse((long) i, "Book " + i, "d", null, null))
                .toList();

        BookPageResponse response = BookPageResponse.from(new PageImpl<>(items, PageRequest.of(2, 10), 23), 3);

        assertThat(response.meta().currentPage()).isEqualTo(3);
        assertThat(response.meta().from()).isEqualTo(21L);
        assertThat(response.meta().to()).isEqualTo(23L);
        assertThat(response.meta().lastPage()).isEqualTo(3);
        assertThat(response.meta().perPage()).isEqualTo(10);
    }
}
