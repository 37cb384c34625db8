package org.smileyface.sitecrawler.crawler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainScopeTest {

    @Test
    void exactHost_withoutSubdomains() {
        DomainScope scope = new DomainScope("https://www.example.com/", false);

        assertThat(scope.isInScope("https://www.example.com/a")).isTrue();
        assertThat(scope.isInScope("http://www.example.com:8080/b")).isTrue();
        assertThat(scope.isInScope("https://docs.example.com/")).isFalse();
        assertThat(scope.isInScope("https://example.com/")).isFalse();
    }

    @Test
    void subdomains_useRegistrableDomain() {
        DomainScope scope = new DomainScope("https://www.example.com/", true);

        assertThat(scope.getRegistrableDomain()).isEqualTo("example.com");
        assertThat(scope.isInScope("https://example.com/")).isTrue();
        assertThat(scope.isInScope("https://docs.example.com/x")).isTrue();
        assertThat(scope.isInScope("https://a.b.example.com/x")).isTrue();
    }

    @Test
    void subdomains_neverMatchBareSuffix() {
        DomainScope scope = new DomainScope("https://example.com/", true);

        assertThat(scope.isInScope("https://notexample.com/")).isFalse();
        assertThat(scope.isInScope("https://example.com.evil.org/")).isFalse();
    }

    @Test
    void subdomains_respectMultiLabelPublicSuffix() {
        DomainScope scope = new DomainScope("https://shop.example.co.uk/", true);

        assertThat(scope.getRegistrableDomain()).isEqualTo("example.co.uk");
        assertThat(scope.isInScope("https://www.example.co.uk/")).isTrue();
        assertThat(scope.isInScope("https://other.co.uk/")).isFalse();
    }

    @Test
    void localhostAndIpHosts_fallBackToExactMatch() {
        assertThat(DomainScope.registrableDomainOf("localhost")).isEqualTo("localhost");
        assertThat(DomainScope.registrableDomainOf("127.0.0.1")).isEqualTo("127.0.0.1");

        DomainScope scope = new DomainScope("http://127.0.0.1:9000/", true);
        assertThat(scope.isInScope("http://127.0.0.1:9000/a")).isTrue();
        assertThat(scope.isInScope("http://127.0.0.2:9000/a")).isFalse();
    }

    @Test
    void seedWithoutHost_isRejected() {
        assertThatThrownBy(() -> new DomainScope("not-a-url", false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
