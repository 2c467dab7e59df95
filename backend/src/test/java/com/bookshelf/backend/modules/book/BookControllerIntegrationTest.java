package com.bookshelf.backend.modules.book;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import com.bookshelf.backend.modules.auth.domain.UserAccount;
import com.bookshelf.backend.modules.book.domain.Book;
import com.bookshelf.backend.modules.book.infrastructure.persistence.BookRepository;
import com.bookshelf.backend.support.AbstractPostgresIntegrationTest;
import com.bookshelf.backend.support.MockMvcLogin;
import com.bookshelf.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class BookControllerIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private BookRepository bookRepository;

    private String systemToken;

    @BeforeEach
    void setUp() throws Exception {
        systemToken = MockMvcLogin.bearer(mockMvc, objectMapper, SYSTEM_ACTOR_EMAIL, SYSTEM_ACTOR_PASSWORD);
    }

    @Test
    void systemActorManagesBooksEndToEnd() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/v1/books")
                        .header(HttpHeaders.AUTHORIZATION, systemToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "Dune", "description", "Desert planet"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Book created successfully"))
                .andExpect(jsonPath("$.data.title").value("Dune"))
                .andExpect(jsonPath("$.data.createdAt").isNotEmpty())
                .andReturn();
        long id = readTree(created).path("data").path("id").asLong();

        mockMvc.perform(get("/api/v1/books/{id}", id).header(HttpHeaders.AUTHORIZATION, systemToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.description").value("Desert planet"))
                .andExpect(jsonPath("$.message").doesNotExist());

        mockMvc.perform(put("/api/v1/books/{id}", id)
                        .header(HttpHeaders.AUTHORIZATION, systemToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "Dune Messiah"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Book updated successfully"))
                .andExpect(jsonPath("$.data.title").value("Dune Messiah"))
                .andExpect(jsonPath("$.data.description").value("Desert planet"));

        mockMvc.perform(delete("/api/v1/books/{id}", id).header(HttpHeaders.AUTHORIZATION, systemToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Book deleted successfully"));

        assertThat(bookRepository.findById(id)).isEmpty();
    }

    @Test
    void listIsPaginatedByTen() throws Exception {
        for (int i = 0; i < 11; i++) {
            bookRepository.save(new Book("Paged " + i, "entry " + i));
        }

        MvcResult first = mockMvc.perform(get("/api/v1/books").header(HttpHeaders.AUTHORIZATION, systemToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.currentPage").value(1))
                .andExpect(jsonPath("$.meta.perPage").value(10))
                .andExpect(jsonPath("$.meta.from").value(1))
                .andExpect(jsonPath("$.meta.to").value(10))
                .andReturn();
        JsonNode meta = readTree(first).path("meta");
        assertThat(readTree(first).path("data").size()).isEqualTo(10);
        assertThat(meta.path("total").asLong()).isGreaterThanOrEqualTo(11);
        assertThat(meta.path("lastPage").asInt()).isGreaterThanOrEqualTo(2);

        mockMvc.perform(get("/api/v1/books").param("page", "2").header(HttpHeaders.AUTHORIZATION, systemToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.meta.currentPage").value(2))
                .andExpect(jsonPath("$.meta.from").value(11));
    }

    @Test
    void missingTitleFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/books")
                        .header(HttpHeaders.AUTHORIZATION, systemToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("description", "No title"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void overlongTitleFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/books")
                        .header(HttpHeaders.AUTHORIZATION, systemToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "x".repeat(256), "description", "Too long"))))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void blankDescriptionOnUpdateFailsValidation() throws Exception {
        Book book = bookRepository.save(new Book("Kept", "Original description"));

        mockMvc.perform(put("/api/v1/books/{id}", book.getId())
                        .header(HttpHeaders.AUTHORIZATION, systemToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("description", "   "))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.detail").value("description: must not be blank"));

        assertThat(bookRepository.findById(book.getId()).orElseThrow().getDescription())
                .isEqualTo("Original description");
    }

    @Test
    void unknownBookIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/books/{id}", Long.MAX_VALUE).header(HttpHeaders.AUTHORIZATION, systemToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BOOK_NOT_FOUND"));
    }

    @Test
    void userWithoutPermissionIsForbidden() throws Exception {
        UserAccount reader = testUserFactory.createUser("reader");
        String token = MockMvcLogin.bearer(mockMvc, objectMapper, reader.getEmail(), TestUserFactory.DEFAULT_PASSWORD);

        mockMvc.perform(post("/api/v1/books")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "Blocked", "description", "Denied"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value("This action is unauthorized."));
    }

    @Test
    void grantedPermissionOpensOnlyItsRoute() throws Exception {
        UserAccount viewer = testUserFactory.createUser("viewer");
        testUserFactory.grant(viewer, "books.list");
        String token = MockMvcLogin.bearer(mockMvc, objectMapper, viewer.getEmail(), TestUserFactory.DEFAULT_PASSWORD);
        Book book = bookRepository.save(new Book("Visible", "Listed only"));

        mockMvc.perform(get("/api/v1/books").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/books/{id}", book.getId()).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isForbidden());
        mockMvc.perform(delete("/api/v1/books/{id}", book.getId()).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isForbidden());

        assertThat(bookRepository.findById(book.getId())).isPresent();
    }

    private String json(Map<String, ?> body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private JsonNode readTree(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
