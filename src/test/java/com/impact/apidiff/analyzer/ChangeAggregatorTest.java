package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.ChangeKind;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.exception.ContentUnavailableException;
import com.impact.apidiff.service.RevisionContentProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChangeAggregatorTest {

    private static final String BASE = "base";
    private static final String HEAD = "head";

    private ExecutorService executor;
    private RevisionContentProvider provider;
    private ChangeAggregator aggregator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        provider = mock(RevisionContentProvider.class);
        when(provider.baseRevision()).thenReturn(BASE);
        when(provider.headRevision()).thenReturn(HEAD);
        aggregator = new ChangeAggregator(
                new StructuralExtractor(new PythonSyntaxParser()), new SignatureDiffer(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void content(String file, String base, String head) throws ContentUnavailableException {
        when(provider.contentAt(file, BASE)).thenReturn(base);
        when(provider.contentAt(file, HEAD)).thenReturn(head);
    }

    @Test
    @DisplayName("Changes are merged in sorted file order and duplicate paths are analyzed once")
    void mergesInSortedOrder() throws Exception {
        // Arrange
        content("b.py", "def beta(x):\n    pass\n", "def beta():\n    pass\n");
        content("a.py", "def alpha():\n    pass\n", "");

        // Act
        List<ChangeRecord> changes = aggregator.aggregate(List.of("b.py", "a.py", "b.py"), provider);

        // Assert
        assertThat(changes)
                .extracting(ChangeRecord::getFilePath, ChangeRecord::getElementName, ChangeRecord::getKind)
                .containsExactly(
                        tuple("a.py", "alpha", ChangeKind.FUNCTION_REMOVED),
                        tuple("b.py", "beta", ChangeKind.PARAMETER_REMOVED));
    }

    @Test
    @DisplayName("A newly added file reports nothing")
    void addedFileHasNoChanges() throws Exception {
        content("new.py", "", "def fresh(a):\n    pass\n");

        assertThat(aggregator.aggregate(List.of("new.py"), provider)).isEmpty();
    }

    @Test
    @DisplayName("A file that is empty at both revisions is skipped")
    void emptyAtBothRevisions() throws Exception {
        content("blank.py", "", "");

        assertThat(aggregator.analyzeFile("blank.py", provider)).isEmpty();
    }

    @Test
    @DisplayName("A head revision that fails to parse is treated as an empty module")
    void unparseableHeadIsEmptyModule() throws Exception {
        content("bad.py", "def kept():\n    pass\n", "def kept(:\n    pass\n");

        assertThat(aggregator.aggregate(List.of("bad.py"), provider))
                .extracting(ChangeRecord::getKind, ChangeRecord::getElementName)
                .containsExactly(tuple(ChangeKind.FUNCTION_REMOVED, "kept"));
    }

    @Test
    @DisplayName("One syntactically invalid file among three does not stop the other two")
    void parseFailureResilience() throws Exception {
        content("a.py", "def a(x):\n    pass\n", "def a():\n    pass\n");
        content("b.py", "def b(:\n", "def b():\n    pass\n");
        content("c.py", "def c(x=1):\n    pass\n", "def c(x):\n    pass\n");

        List<ChangeRecord> changes = aggregator.aggregate(List.of("a.py", "b.py", "c.py"), provider);

        assertThat(changes)
                .extracting(ChangeRecord::getFilePath, ChangeRecord::getKind)
                .containsExactly(
                        tuple("a.py", ChangeKind.PARAMETER_REMOVED),
                        tuple("c.py", ChangeKind.PARAMETER_BECAME_REQUIRED));
    }

    @Test
    @DisplayName("Unavailable content skips the file and keeps the others")
    void unavailableContentSkipsFile() throws Exception {
        when(provider.contentAt("broken.py", BASE))
                .thenThrow(new ContentUnavailableException("object missing", BASE));
        content("ok.py", "def f(a):\n    pass\n", "def f():\n    pass\n");

        List<ChangeRecord> changes = aggregator.aggregate(List.of("broken.py", "ok.py"), provider);

        assertThat(changes).extracting(ChangeRecord::getFilePath).containsExactly("ok.py");
    }

    @Test
    @DisplayName("A cancelled run starts no per-file work")
    void cancelledRunReadsNothing() throws Exception {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        List<ChangeRecord> changes = aggregator.aggregate(List.of("a.py", "b.py"), provider, cancellation);

        assertThat(changes).isEmpty();
        verify(provider, never()).contentAt(anyString(), anyString());
    }
}
