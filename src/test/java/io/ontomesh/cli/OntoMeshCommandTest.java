package io.ontomesh.cli;

import io.ontomesh.config.OntoMeshConfig;
import io.ontomesh.runtime.OntoMeshRuntime;
import io.ontomesh.storage.DatasourceStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.stream.Stream;

final class OntoMeshCommandTest {
    @Test
    void extractThroughCommandsAndExportOntology() throws Exception {
        Path root = Files.createTempDirectory("ontomesh-test-cli");
        try {
            Path source = root.resolve("catalog.db");
            try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + source); Statement st = c.createStatement()) {
                st.execute("CREATE TABLE authors (id INTEGER PRIMARY KEY, name TEXT)");
                st.execute("CREATE TABLE books (id INTEGER PRIMARY KEY, author_id INTEGER, title TEXT)");
                st.execute("INSERT INTO authors(id,name) VALUES (1,'Le Guin'),(2,'Lem'),(3,'Banks')");
                st.execute("INSERT INTO books(id,author_id,title) VALUES (10,1,'Lathe'),(11,2,'Solaris'),(12,3,'Excession')");
            }
            Assertions.assertEquals(0, run(root, "init"));
            Assertions.assertTrue(Files.exists(root.resolve("ontomesh.db")));

            OntoMeshRuntime setup = new OntoMeshRuntime(OntoMeshConfig.fromRoot(root.toString()));
            setup.init();
            DatasourceStore.Datasource ds = setup.registerDatasource("proj_books", "catalog", "jdbc:sqlite:" + source);

            Assertions.assertEquals(0, run(root, "schema-import", "--datasource", ds.id()));
            Assertions.assertEquals(0, run(root, "extract", "--project", "proj_books", "--datasource", ds.id(),
                    "--timeout-ms", "20000"));
            Assertions.assertEquals(0, run(root, "ontology", "--project", "proj_books", "--export"));
            Assertions.assertTrue(Files.exists(root.resolve("ontology").resolve("proj_books.json")));
            Assertions.assertEquals(0, run(root, "audit-verify"));

            Assertions.assertEquals(1, run(root, "ontology", "--project", "proj_unknown"));
            Assertions.assertNotEquals(0, run(root, "schema-import", "--datasource", "ds_missing"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return new CommandLine(new OntoMeshCommand()).execute(full);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
