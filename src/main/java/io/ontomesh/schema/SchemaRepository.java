package io.ontomesh.schema;

import io.ontomesh.model.SchemaColumn;
import io.ontomesh.model.SchemaRelationship;
import io.ontomesh.model.SchemaTable;

import java.util.List;
import java.util.Optional;

/**
 * Read and write access to the stored schema inventory of a datasource.
 */
public interface SchemaRepository {
    List<SchemaTable> listTablesByDatasource(String datasourceId);

    List<SchemaColumn> listColumnsByDatasource(String datasourceId);

    Optional<SchemaTable> getTable(String tableId);

    Optional<SchemaColumn> getColumn(String columnId);

    /**
     * Inserts or replaces every relationship atomically: either all rows are written or none.
     */
    void upsertRelationships(List<SchemaRelationship> relationships);

    List<SchemaRelationship> listRelationships(String datasourceId);
}
