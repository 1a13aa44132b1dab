package io.ontomesh.schema;

@FunctionalInterface
public interface DiscovererFactory {
    SchemaDiscoverer open(String datasourceId) throws Exception;
}
