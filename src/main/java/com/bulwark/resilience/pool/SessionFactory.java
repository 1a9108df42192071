package com.bulwark.resilience.pool;

import com.bulwark.model.HostKey;

/**
 * Opens network sessions for the connection pool.
 */
public interface SessionFactory {

    HostSession open(HostKey host);
}
