package com.bookshelf.backend.modules.book.application;

import com.bookshelf.backend.global.error.ProblemException;
import com.bookshelf.backend.modules.book.domain.Book;
import com.bookshelf.backend.modules.book.infrastructure.persistence.BookRepository;
import com.bookshelf.backend.modules.book.presentation.dto.BookPageResponse;
import com.bookshelf.backend.modules.book.presentation.dto.BookResponse;
import com.bookshelf.backend.modules.book.presentation.dto.CreateBookRequest;
import com.bookshelf.backend.modules.book.presentation.dto.UpdateBookRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    public static final int PAGE_SIZE = 10;

    private final BookRepository bookRepository;

    public BookService(BookRepository bookRepository) {
        this.bookRepository = bookRepository;
    }

    /**
     * @param page 1-based page number; values below 1 read the first page
     */
    @Transactional(readOnly = true)
    public BookPageResponse list(int page) {
        int currentPage = Math.max(page, 1);
        Page<Book> result = bookRepository.findAll(
                PageRequest.of(currentPage - 1, PAGE_SIZE, Sort.by(Sort.Direction.ASC, "id")));
        return BookPageResponse.from(result.map(BookResponse::from), currentPage);
    }

    @Transactional(readOnly = true)
    public BookResponse get(Long id) {
        return BookResponse.from(findBook(id));
    }

    public BookResponse create(CreateBookRequest request) {
        Book saved = bookRepository.saveAndFlush(new Book(request.title().trim(), request.description()));
        log.info("Book created id={}", saved.getId());
        return BookResponse.from(saved);
    }

    public BookResponse update(Long id, UpdateBookRequest request) {
        Book book = findBook(id);
        if (request.title() != null) {
            if (request.title().isBlank()) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", "title: must not be blank");
            }
            book.setTitle(request.title().trim());
        }
        if (request.description() != null) {
            if (request.description().isBlank()) {
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", "description: must not be blank");
            }
            book.setDescription(request.description());
        }
        Book saved = bookRepository.saveAndFlush(book);
        log.info("Book updated id={}", id);
        return BookResponse.from(saved);
    }

    public void delete(Long id) {
        bookRepository.delete(findBook(id));
        log.info("Book deleted id={}", id);
    }

    private Book findBook(Long id) {
        return bookRepository.findById(id)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "BOOK_NOT_FOUND", "Book not found: " + id));
    }
}
