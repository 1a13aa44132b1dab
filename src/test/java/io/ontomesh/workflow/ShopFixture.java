package io.ontomesh.workflow;

import io.ontomesh.config.OntoMeshConfig;
import io.ontomesh.runtime.OntoMeshRuntime;
import io.ontomesh.schema.EntityAnalyzer;
import io.ontomesh.schema.HeuristicEntityAnalyzer;
import io.ontomesh.storage.DatasourceStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.stream.Stream;

/**
 * A small SQLite shop database (users, orders) registered and imported into a fresh runtime
 * whose settings poll and back off in milliseconds.
 */
final class ShopFixture implements AutoCloseable {
    static final String PROJECT = "proj_shop";

    final Path root;
    final OntoMeshRuntime runtime;
    final DatasourceStore.Datasource datasource;

    private ShopFixture(Path root, OntoMeshRuntime runtime, DatasourceStore.Datasource datasource) {
        this.root = root;
        this.runtime = runtime;
        this.datasource = datasource;
    }

    static ShopFixture create(String prefix) throws Exception {
        return create(prefix, new HeuristicEntityAnalyzer());
    }

    static ShopFixture create(String prefix, EntityAnalyzer analyzer) throws Exception {
        Path root = Files.createTempDirectory(prefix);
        Path source = root.resolve("shop.db");
        writeShop(source);
        Files.writeString(root.resolve("ontomesh-settings.json"), """
                {
                  "pollIntervalMs": 50,
                  "heartbeatIntervalMs": 200,
                  "stopWaitMs": 2000,
                  "maxRetries": 1,
                  "initialBackoffMs": 10,
                  "maxBackoffMs": 20
                }
                """, StandardCharsets.UTF_8);
        OntoMeshRuntime runtime = new OntoMeshRuntime(OntoMeshConfig.fromRoot(root.toString()), analyzer);
        runtime.init();
        DatasourceStore.Datasource ds = runtime.registerDatasource(PROJECT, "shop", "jdbc:sqlite:" + source);
        runtime.importSchema(ds.id());
        return new ShopFixture(root, runtime, ds);
    }

    private static void writeShop(Path file) throws SQLException {
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + file); Statement st = c.createStatement()) {
            st.execute("CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT NOT NULL)");
            st.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY, user_id INTEGER REFERENCES users(id), total REAL)");
            st.execute("""
                    INSERT INTO users(id,email) VALUES
                        (1,'ada@example.com'),(2,'alan@example.com'),(3,'grace@example.com'),
                        (4,'edsger@example.com'),(5,'barbara@example.com')
                    """);
            st.execute("""
                    INSERT INTO orders(id,user_id,total) VALUES
                        (101,1,19.5),(102,1,250.25),(103,2,42.75),(104,3,77.1),(105,4,310.9),(106,5,64.3)
                    """);
        }
    }

    @Override
    public void close() throws IOException {
        runtime.shutdown(2_000L);
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
