package io.ontomesh.schema;

import io.ontomesh.model.WorkflowException;
import io.ontomesh.storage.DatasourceStore;

/**
 * Opens a {@link JdbcSchemaDiscoverer} on the JDBC URL registered for a datasource.
 */
public final class JdbcDiscovererFactory implements DiscovererFactory {
    private final DatasourceStore datasources;

    public JdbcDiscovererFactory(DatasourceStore datasources) {
        this.datasources = datasources;
    }

    @Override
    public SchemaDiscoverer open(String datasourceId) throws Exception {
        DatasourceStore.Datasource ds = datasources.get(datasourceId)
                .orElseThrow(() -> new WorkflowException("datasource not found: " + datasourceId));
        return JdbcSchemaDiscoverer.open(ds.jdbcUrl());
    }
}
