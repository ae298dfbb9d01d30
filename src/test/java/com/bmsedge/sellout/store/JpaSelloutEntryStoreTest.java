package com.bmsedge.sellout.store;

import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.exception.StorageException;
import com.bmsedge.sellout.model.SelloutEntry;
import com.bmsedge.sellout.repository.SelloutEntryRepository;
import com.bmsedge.sellout.util.WireRecordConverter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JpaSelloutEntryStoreTest {

    @Mock
    private SelloutEntryRepository selloutEntryRepository;

    @InjectMocks
    private JpaSelloutEntryStore selloutEntryStore;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private static Map<String, Object> record() {
        CanonicalEntry entry = CanonicalEntry.builder()
                .uploadId("upload-1")
                .reseller("Skins NL")
                .productEan("7350154459")
                .month(2)
                .year(2025)
                .quantity(2)
                .salesLc("116")
                .salesEur(new BigDecimal("116"))
                .currency("EUR")
                .functionalName("")
                .build();
        return WireRecordConverter.toWireRecord(entry, Instant.parse("2025-03-01T08:00:00Z"));
    }

    @Test
    @DisplayName("Records are stored as entities in one call")
    @SuppressWarnings("unchecked")
    void testSaveBatch() {
        // Arrange
        when(selloutEntryRepository.countByUploadId("upload-1")).thenReturn(0L);
        ArgumentCaptor<List<SelloutEntry>> captor = ArgumentCaptor.forClass(List.class);

        // Act
        selloutEntryStore.saveBatch("upload-1", List.of(record(), record()));

        // Assert
        verify(selloutEntryRepository).saveAll(captor.capture());
        List<SelloutEntry> saved = captor.getValue();
        assertEquals(2, saved.size());
        SelloutEntry entity = saved.get(0);
        assertEquals("upload-1", entity.getUploadId());
        assertEquals("Skins NL", entity.getReseller());
        assertEquals(2, entity.getMonth());
        assertEquals(2025, entity.getYear());
        assertEquals(2, entity.getQuantity());
        assertEquals("116", entity.getSalesLc());
        assertEquals(0, new BigDecimal("116").compareTo(entity.getSalesEur()));
        assertEquals(Instant.parse("2025-03-01T08:00:00Z"), entity.getCreatedAt());
    }

    @Test
    @DisplayName("A first batch reports that it was written")
    void testSaveBatchReturnsTrue() {
        when(selloutEntryRepository.countByUploadId("upload-1")).thenReturn(0L);

        assertTrue(selloutEntryStore.saveBatch("upload-1", List.of(record())));
    }

    @Test
    @DisplayName("Re-submitting the batch already stored is a no-op")
    void testIdenticalResubmissionIgnored() {
        // Arrange
        when(selloutEntryRepository.countByUploadId("upload-1")).thenReturn(2L);
        when(selloutEntryRepository.findByUploadId("upload-1")).thenReturn(List.of(
                SelloutEntry.fromWireRecord(record()), SelloutEntry.fromWireRecord(record())));

        // Act
        boolean stored = selloutEntryStore.saveBatch("upload-1", List.of(record(), record()));

        // Assert
        assertFalse(stored);
        verify(selloutEntryRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("A stored entity reads back with sales_eur at its shortest scale")
    void testStoredScaleIgnoredOnReplay() {
        // Arrange
        CanonicalEntry stored = WireRecordConverter.fromWireRecord(record()).toBuilder()
                .salesEur(new BigDecimal("116.00"))
                .build();
        when(selloutEntryRepository.countByUploadId("upload-1")).thenReturn(1L);
        when(selloutEntryRepository.findByUploadId("upload-1")).thenReturn(List.of(
                SelloutEntry.fromCanonicalEntry(stored, Instant.now())));

        // Act & Assert
        assertFalse(selloutEntryStore.saveBatch("upload-1", List.of(record())));
        verify(selloutEntryRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("A different batch for an upload already stored is refused")
    void testRejectsResubmission() {
        // Arrange
        when(selloutEntryRepository.countByUploadId("upload-1")).thenReturn(2L);
        when(selloutEntryRepository.findByUploadId("upload-1")).thenReturn(List.of(
                SelloutEntry.fromWireRecord(record()), SelloutEntry.fromWireRecord(record())));

        // Act & Assert
        assertThrows(StorageException.class, () -> selloutEntryStore.saveBatch("upload-1", List.of(record())));
        verify(selloutEntryRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("Repository failures surface as storage errors")
    void testRepositoryFailure() {
        when(selloutEntryRepository.countByUploadId("upload-1")).thenReturn(0L);
        when(selloutEntryRepository.saveAll(anyList())).thenThrow(new IllegalStateException("connection reset"));

        StorageException exception = assertThrows(StorageException.class,
                () -> selloutEntryStore.saveBatch("upload-1", List.of(record())));
        assertEquals("STORAGE_FAILED", exception.getErrorCode());
        assertTrue(exception.getCause() instanceof IllegalStateException);
    }
}
