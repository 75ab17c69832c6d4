package org.fmrest.dataapi.rest;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Placeholder for the content of a container field: the URL the server streams it from.
 * The content itself is fetched on demand with
 * {@link FileMakerServer#fetchContainer(ContainerReference)}.
 */
@Getter
@EqualsAndHashCode
public class ContainerReference {

    private final String url;

    public ContainerReference(String url) {
        this.url = url;
    }

    /**
     * File name taken from the last path segment of the URL. The server does not always
     * include an extension, so none is assumed.
     */
    public String getFileName() {
        String path = url.split("\\?")[0];
        return path.substring(path.lastIndexOf('/') + 1);
    }

    @Override
    public String toString() {
        return url;
    }
}
