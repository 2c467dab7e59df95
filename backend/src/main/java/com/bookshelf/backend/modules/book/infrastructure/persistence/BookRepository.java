package com.bookshelf.backend.modules.book.infrastructure.persistence;

import com.bookshelf.backend.modules.book.domain.Book;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BookRepository extends JpaRepository<Book, Long> {
}
