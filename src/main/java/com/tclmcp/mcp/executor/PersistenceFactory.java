package com.tclmcp.mcp.executor;

import com.tclmcp.mcp.errors.PersistenceException;
import com.tclmcp.mcp.persistence.FilePersistence;

/**
 * Opens the tool store on first use.
 */
@FunctionalInterface
public interface PersistenceFactory {

    FilePersistence open() throws PersistenceException;
}
