package de.conciso.medcontext.api;

import de.conciso.medcontext.config.TestSourceProperties;
import de.conciso.medcontext.model.Subject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WikipediaClientTest {

    private MockRestServiceServer server;
    private WikipediaClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new WikipediaClient(builder, TestSourceProperties.create(""));
    }

    @Test
    void returnsTrimmedExtract() {
        server.expect(requestTo(TestSourceProperties.WIKIPEDIA_URL + "/Acetylsalicylic_acid"))
                .andRespond(withSuccess("""
                        {"title": "Aspirin", "extract": " Aspirin is a medication. \\n"}
                        """, MediaType.APPLICATION_JSON));

        assertThat(client.summary(Subject.of("Acetylsalicylic acid")))
                .contains("Aspirin is a medication.");
        server.verify();
    }

    @Test
    void missingPageIsEmpty() {
        server.expect(requestTo(TestSourceProperties.WIKIPEDIA_URL + "/Nonexistium"))
                .andRespond(withResourceNotFound());

        assertThat(client.summary(Subject.of("Nonexistium"))).isEmpty();
    }

    @Test
    void blankExtractIsEmpty() {
        server.expect(requestTo(TestSourceProperties.WIKIPEDIA_URL + "/Warfarin"))
                .andRespond(withSuccess("{\"title\": \"Warfarin\", \"extract\": \"  \"}", MediaType.APPLICATION_JSON));

        assertThat(client.summary(Subject.of("Warfarin"))).isEmpty();
    }

    @Test
    void serverErrorIsPropagated() {
        server.expect(requestTo(TestSourceProperties.WIKIPEDIA_URL + "/Warfarin"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.summary(Subject.of("Warfarin")))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
