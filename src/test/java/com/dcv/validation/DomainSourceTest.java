package com.dcv.validation;

import com.dcv.api.ApiException;
import com.dcv.digicert.CertificateAuthorityClient;
import com.dcv.domain.DcvExpiration;
import com.dcv.domain.DcvMethod;
import com.dcv.domain.Domain;
import com.dcv.ultradns.DnsProviderClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DomainSourceTest {

    private static final Clock CLOCK = Clock.fixed(
            LocalDateTime.of(2024, 1, 15, 12, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private static final Domain EXPIRING = new Domain("1", "example.com", DcvMethod.DNS_CNAME_TOKEN,
            new DcvExpiration(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 1)));
    private static final Domain FRESH = new Domain("2", "example.org", DcvMethod.EMAIL,
            new DcvExpiration(LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 1)));
    private static final Domain NEW = new Domain("3", "example.net", DcvMethod.EMAIL, null);

    @Mock
    private CertificateAuthorityClient ca;

    @Mock
    private DnsProviderClient dns;

    @TempDir
    Path tempDir;

    private DomainSource source;
    private AutoCloseable closeable;

    @BeforeEach
    void setUp() {
        closeable = MockitoAnnotations.openMocks(this);
        source = new DomainSource(ca, dns, new ExpirationSelector(CLOCK));
    }

    @AfterEach
    void tearDown() throws Exception {
        closeable.close();
    }

    @Test
    void expirationQuery() throws Exception {
        when(ca.listDomains()).thenReturn(List.of(EXPIRING, FRESH, NEW));

        Candidates candidates = source.resolve(RunRequest.expiring(90, 60));

        assertEquals(List.of(EXPIRING, NEW), candidates.domains());
        assertTrue(candidates.skipped().isEmpty());
    }

    @Test
    void explicitNamesIgnoreExpiration() throws Exception {
        when(ca.findDomains("example.org")).thenReturn(List.of(FRESH));
        when(ca.findDomains("unknown.com")).thenReturn(List.of());
        when(dns.zoneExists("example.org")).thenReturn(true);

        Candidates candidates = source.resolve(RunRequest.explicit(List.of("example.org", "unknown.com"), 60));

        assertEquals(List.of(FRESH), candidates.domains());
        assertEquals("Domain not found in DigiCert.", candidates.skipped().get("unknown.com"));
        verify(ca, never()).listDomains();
    }

    @Test
    void explicitNameWithoutZone() throws Exception {
        when(ca.findDomains("example.org")).thenReturn(List.of(FRESH));
        when(dns.zoneExists("example.org")).thenReturn(false);

        Candidates candidates = source.resolve(RunRequest.explicit(List.of("example.org"), 60));

        assertTrue(candidates.isEmpty());
        assertEquals("DNS zone not found in UltraDNS.", candidates.skipped().get("example.org"));
    }

    @Test
    void explicitNamesWithoutZoneCheck() throws Exception {
        when(ca.findDomains("example.org")).thenReturn(List.of(FRESH));

        Candidates candidates = source.resolve(new RunRequest(List.of("example.org"), null, 90, 60, false));

        assertEquals(List.of(FRESH), candidates.domains());
        verify(dns, never()).zoneExists(anyString());
    }

    @Test
    void fileMatchesThenFiltersByExpiration() throws Exception {
        Path file = tempDir.resolve("domains.txt");
        Files.writeString(file, "# renewals\nEXAMPLE.com\n\nexample.org\ntypo.example.com\nexample.com\n");
        when(ca.listDomains()).thenReturn(List.of(EXPIRING, FRESH, NEW));

        Candidates candidates = source.resolve(new RunRequest(List.of(), file, 90, 60, false));

        assertEquals(List.of(EXPIRING), candidates.domains());
        assertEquals(Set.of("typo.example.com"), candidates.skipped().keySet());
        assertEquals("Domain not found in DigiCert, check spelling.", candidates.skipped().get("typo.example.com"));
    }

    @Test
    void explicitNamesTakePrecedenceOverFile() throws Exception {
        when(ca.findDomains("example.com")).thenReturn(List.of(EXPIRING));

        Candidates candidates = source.resolve(
                new RunRequest(List.of("example.com"), tempDir.resolve("missing.txt"), 90, 60, false));

        assertEquals(List.of(EXPIRING), candidates.domains());
    }

    @Test
    void missingFile() {
        assertThrows(NoSuchFileException.class,
                () -> source.resolve(new RunRequest(List.of(), tempDir.resolve("missing.txt"), 90, 60, false)));
    }

    @Test
    void listFailurePropagates() throws Exception {
        when(ca.listDomains()).thenThrow(new ApiException(ApiException.Kind.STATUS, "HTTP 500", 500));

        ApiException e = assertThrows(ApiException.class, () -> source.resolve(RunRequest.expiring(90, 60)));
        assertEquals(500, e.getStatusCode());
    }

    @Test
    void readFile() throws IOException {
        Set<String> names = DomainFile.read(Path.of("src/test/resources/domains.txt"));

        assertEquals(List.of("example.com", "example.org", "www.example.net"), List.copyOf(names));
    }
}
