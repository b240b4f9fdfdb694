package io.poolermanager.store;

import lombok.Getter;

@Getter
public class ResourceNotFoundException extends ClusterStoreException {

    private final String kind;
    private final String namespace;
    private final String name;

    public ResourceNotFoundException(String kind, String namespace, String name) {
        super(kind + " " + namespace + "/" + name + " not found");
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
    }
}
