package io.diagramsessions.server.spi;

import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.Point;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryModelPersistenceTest {

    private static final Executor DIRECT = Runnable::run;

    @Test
    void testLoadMissing() {
        InMemoryModelPersistence persistence = new InMemoryModelPersistence();
        assertEquals(Optional.empty(), persistence.load("file:///missing"));
    }

    @Test
    void testSaveThenLoad() {
        InMemoryModelPersistence persistence = new InMemoryModelPersistence();
        ModelElement root = ModelElement.emptyRoot().withChild(ModelElement.node("task", "t1", new Point(1, 2)));

        persistence.save("file:///a", root);

        assertEquals(root, persistence.load("file:///a").orElseThrow());
        assertFalse(persistence.load("file:///b").isPresent());
    }

    @Test
    void testNullUriIsItsOwnKey() {
        ModelElement root = ModelElement.emptyRoot();
        InMemoryModelPersistence persistence = new InMemoryModelPersistence(Map.of("", root));

        assertEquals(root, persistence.load(null).orElseThrow());
    }

    @Test
    void testExport() {
        InMemoryModelPersistence persistence = new InMemoryModelPersistence();
        persistence.export("file:///a", "<svg/>");
        assertEquals("<svg/>", persistence.exported("file:///a").orElseThrow());
    }

    @Test
    void testAsyncAdapterDelegates() {
        InMemoryModelPersistence blocking = new InMemoryModelPersistence();
        AsyncModelPersistence async = new BlockingToAsyncPersistence(blocking, DIRECT);

        async.save("file:///a", ModelElement.emptyRoot()).join();

        assertTrue(async.load("file:///a").join().isPresent());
    }

    @Test
    void testAsyncAdapterWrapsCheckedExceptions() {
        ModelPersistence failing = new ModelPersistence() {
            @Override
            public Optional<ModelElement> load(String sourceUri) throws Exception {
                throw new IOException("disk gone");
            }

            @Override
            public void save(String sourceUri, ModelElement root) {
            }

            @Override
            public void export(String sourceUri, String svg) {
            }
        };
        AsyncModelPersistence async = new BlockingToAsyncPersistence(failing, DIRECT);

        CompletionException thrown = assertThrows(CompletionException.class, () -> async.load("x").join());
        assertInstanceOf(BlockingToAsyncPersistence.PersistenceException.class, thrown.getCause());
        assertEquals("disk gone", thrown.getCause().getMessage());
    }
}
