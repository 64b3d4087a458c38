package com.example.products.config;

import com.example.products.dto.ProductRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonConfigTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        Jackson2ObjectMapperBuilder builder = new Jackson2ObjectMapperBuilder();
        new JacksonConfig().strictScalarCustomizer().customize(builder);
        objectMapper = builder.build();
    }

    @Test
    void readsWellTypedPayload() throws Exception {
        ProductRequest request = objectMapper.readValue(
                "{\"name\":\"Chair\",\"price\":49,\"color\":\"red\",\"stock\":10}", ProductRequest.class);

        assertThat(request).isEqualTo(new ProductRequest("Chair", 49.0, "red", 10));
    }

    @Test
    void rejectsNumberForName() {
        assertThatThrownBy(() -> objectMapper.readValue(
                "{\"name\":123,\"price\":1,\"color\":\"red\",\"stock\":1}", ProductRequest.class))
                .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    void rejectsBooleanForColor() {
        assertThatThrownBy(() -> objectMapper.readValue(
                "{\"name\":\"Chair\",\"price\":1,\"color\":true,\"stock\":1}", ProductRequest.class))
                .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    void rejectsStringForPrice() {
        assertThatThrownBy(() -> objectMapper.readValue(
                "{\"name\":\"Chair\",\"price\":\"49.99\",\"color\":\"red\",\"stock\":1}", ProductRequest.class))
                .isInstanceOf(MismatchedInputException.class);
    }

    @Test
    void rejectsStringForStock() {
        assertThatThrownBy(() -> objectMapper.readValue(
                "{\"name\":\"Chair\",\"price\":1,\"color\":\"red\",\"stock\":\"10\"}", ProductRequest.class))
                .isInstanceOf(MismatchedInputException.class);
    }
}
