package com.bookshelf.backend.modules.book.presentation;

import com.bookshelf.backend.modules.authorization.presentation.RequiresPermission;
import com.bookshelf.backend.modules.book.application.BookService;
import com.bookshelf.backend.modules.book.presentation.dto.BookEnvelope;
import com.bookshelf.backend.modules.book.presentation.dto.BookPageResponse;
import com.bookshelf.backend.modules.book.presentation.dto.CreateBookRequest;
import com.bookshelf.backend.modules.book.presentation.dto.MessageResponse;
import com.bookshelf.backend.modules.book.presentation.dto.UpdateBookRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/books")
public class BookController {

    private final BookService bookService;

    public BookController(BookService bookService) {
        this.bookService = bookService;
    }

    @Operation(summary = "List books, ten per page")
    @RequiresPermission("books.list")
    @GetMapping
    public ResponseEntity<BookPageResponse> list(@RequestParam(name = "page", defaultValue = "1") int page) {
        return ResponseEntity.ok(bookService.list(page));
    }

    @Operation(summary = "Create a book")
    @RequiresPermission("books.create")
    @PostMapping
    public ResponseEntity<BookEnvelope> create(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BookEnvelope.of(bookService.create(request), "Book created successfully"));
    }

    @Operation(summary = "Show a book")
    @RequiresPermission("books.view")
    @GetMapping("/{id}")
    public ResponseEntity<BookEnvelope> show(@PathVariable("id") Long id) {
        return ResponseEntity.ok(BookEnvelope.of(bookService.get(id)));
    }

    @Operation(summary = "Update a book")
    @RequiresPermission("books.edit")
    @PutMapping("/{id}")
    public ResponseEntity<BookEnvelope> update(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateBookRequest request
    ) {
        return ResponseEntity.ok(BookEnvelope.of(bookService.update(id, request), "Book updated successfully"));
    }

    @Operation(summary = "Delete a book")
    @RequiresPermission("books.delete")
    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable("id") Long id) {
        bookService.delete(id);
        return ResponseEntity.ok(new MessageResponse("Book deleted successfully"));
    }
}
