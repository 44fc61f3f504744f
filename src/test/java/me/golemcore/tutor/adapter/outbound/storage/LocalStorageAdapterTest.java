package me.golemcore.tutor.adapter.outbound.storage;

import me.golemcore.tutor.infrastructure.config.TutorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String CONTEXTS = "contexts";
    private static final String MESSAGES = "messages";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        TutorProperties properties = new TutorProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsWorkspaceDirectories() {
        for (String dir : LocalStorageAdapter.DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(dir)), dir);
        }
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(CONTEXTS, "user-1/subject_1.json", "{\"userId\":\"user-1\"}").get();

        assertEquals("{\"userId\":\"user-1\"}", storageAdapter.getText(CONTEXTS, "user-1/subject_1.json").get());
        assertTrue(storageAdapter.exists(CONTEXTS, "user-1/subject_1.json").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(CONTEXTS, "nobody/none.json").get());
        assertFalse(storageAdapter.exists(CONTEXTS, "nobody/none.json").get());
    }

    @Test
    void appendText_accumulatesLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(MESSAGES, "user-1/subject_1.jsonl", "{\"id\":\"a\"}\n").get();
        storageAdapter.appendText(MESSAGES, "user-1/subject_1.jsonl", "{\"id\":\"b\"}\n").get();

        assertEquals("{\"id\":\"a\"}\n{\"id\":\"b\"}\n",
                storageAdapter.getText(MESSAGES, "user-1/subject_1.jsonl").get());
    }

    @Test
    void putTextAtomic_keepsBackupOfPreviousVersion() throws Exception {
        storageAdapter.putTextAtomic(CONTEXTS, "user-1/subject_1.json", "v1", true).get();
        storageAdapter.putTextAtomic(CONTEXTS, "user-1/subject_1.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(CONTEXTS, "user-1/subject_1.json").get());
        assertEquals("v1", Files.readString(tempDir.resolve(CONTEXTS).resolve("user-1/subject_1.json.bak")));
        assertFalse(Files.exists(tempDir.resolve(CONTEXTS).resolve("user-1/subject_1.json.tmp")));
    }

    @Test
    void listObjects_returnsFilesUnderPrefix() throws ExecutionException, InterruptedException {
        storageAdapter.putText(CONTEXTS, "user-1/subject_1.json", "{}").get();
        storageAdapter.putText(CONTEXTS, "user-1/subject_2.json", "{}").get();
        storageAdapter.putText(CONTEXTS, "user-2/subject_3.json", "{}").get();

        List<String> objects = storageAdapter.listObjects(CONTEXTS, "user-1").get();

        assertEquals(2, objects.size());
        assertTrue(objects.stream().allMatch(name -> name.startsWith("user-1")));
        assertTrue(storageAdapter.listObjects(CONTEXTS, "user-9").get().isEmpty());
    }

    @Test
    void deleteObject_removesFile() throws ExecutionException, InterruptedException {
        storageAdapter.putText(CONTEXTS, "user-1/subject_1.json", "{}").get();

        storageAdapter.deleteObject(CONTEXTS, "user-1/subject_1.json").get();

        assertFalse(storageAdapter.exists(CONTEXTS, "user-1/subject_1.json").get());
    }

    @Test
    void pathTraversal_isBlocked() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(CONTEXTS, "../../etc/passwd").get());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
