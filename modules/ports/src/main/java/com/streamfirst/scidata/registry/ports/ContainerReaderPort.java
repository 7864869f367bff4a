package com.streamfirst.scidata.registry.ports;

import com.streamfirst.scidata.registry.domain.ContainerArchive;

import java.io.InputStream;

/**
 * Port for unpacking a packaged scientific data container into metadata and member files.
 */
public interface ContainerReaderPort {

    /**
     * Reads and parses a container.
     *
     * @param container the packaged container
     * @return the parsed archive
     * @throws com.streamfirst.scidata.registry.domain.ValidationException if the format is
     *     unsupported or the container's metadata files are missing or malformed
     */
    ContainerArchive read(InputStream container);
}
