package org.smileyface.sitecrawler.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlRecordTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void fetchedRecord_serializesAllFieldsInOrder_withoutError() throws Exception {
        CrawlRecord record = CrawlRecord.fetched("https://e.com/a", 1, 200, "text/html",
                "data/raw/a_0123456789.html", "data/text/a_0123456789.txt", "A page");

        String json = mapper.writeValueAsString(record);

        assertThat(json).isEqualTo("{\"url\":\"https://e.com/a\",\"status\":200,\"content_type\":\"text/html\","
                + "\"saved_raw\":\"data/raw/a_0123456789.html\",\"saved_text\":\"data/text/a_0123456789.txt\","
                + "\"title\":\"A page\",\"depth\":1}");
    }

    @Test
    void skipRecord_hasTagAndNullArtifacts() throws Exception {
        String json = mapper.writeValueAsString(CrawlRecord.disallowed("https://e.com/p", 2));

        assertThat(json).isEqualTo("{\"url\":\"https://e.com/p\",\"status\":\"disallowed_by_robots\","
                + "\"content_type\":null,\"saved_raw\":null,\"saved_text\":null,\"title\":null,\"depth\":2}");
    }

    @Test
    void errorRecord_keepsKnownFieldsAndDetail() {
        CrawlRecord record = CrawlRecord.failed("https://e.com/x", 0, CrawlStatus.ERROR_PERSIST, 200,
                "application/pdf", null, "persist: disk full");

        assertThat(record.getStatus()).isEqualTo("error");
        assertThat(record.getHttpStatus()).isEqualTo(200);
        assertThat(record.getContentType()).isEqualTo("application/pdf");
        assertThat(record.getError()).isEqualTo("persist: disk full");
    }

    @Test
    void failed_rejectsNonErrorStatus() {
        assertThatThrownBy(() -> CrawlRecord.failed("https://e.com/", 0, CrawlStatus.OK, 200, null, null, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
