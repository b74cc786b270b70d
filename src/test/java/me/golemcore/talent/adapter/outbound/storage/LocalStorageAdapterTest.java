package me.golemcore.talent.adapter.outbound.storage;

import me.golemcore.talent.infrastructure.config.TalentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String RECORDS_DIR = "records";
    private static final String FILE = "employees.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        TalentProperties properties = new TalentProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateRecordsDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(RECORDS_DIR)));
    }

    @Test
    void putTextAtomic_writesAndReadsBack() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(RECORDS_DIR, FILE, "[{\"id\":1}]", false).get();

        assertEquals("[{\"id\":1}]", storageAdapter.getText(RECORDS_DIR, FILE).get());
        assertTrue(Files.isRegularFile(tempDir.resolve(RECORDS_DIR).resolve(FILE)));
    }

    @Test
    void putTextAtomic_keepsBackupOfPreviousVersion() throws Exception {
        storageAdapter.putTextAtomic(RECORDS_DIR, FILE, "v1", true).get();
        storageAdapter.putTextAtomic(RECORDS_DIR, FILE, "v2", true).get();

        assertEquals("v2", storageAdapter.getText(RECORDS_DIR, FILE).get());
        assertEquals("v1", Files.readString(tempDir.resolve(RECORDS_DIR).resolve(FILE + ".bak")));
        assertFalse(Files.exists(tempDir.resolve(RECORDS_DIR).resolve(FILE + ".tmp")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(RECORDS_DIR, "missing.json").get());
    }

    @Test
    void putTextAtomic_createsMissingParentDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("exports/2026", FILE, "[]", false).get();

        assertEquals("[]", storageAdapter.getText("exports/2026", FILE).get());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> storageAdapter.getText(RECORDS_DIR, "../../outside.json").join());

        assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
    }
}
