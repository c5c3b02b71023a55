package io.github.yok.chunkload.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Identity of the running process as stored in the ledger's {@code owner_id} column
 * ({@code pid@host}).
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ProcessIdentity {

    private final long pid;

    private final String host;

    /**
     * Creates the identity of the current JVM.
     */
    public ProcessIdentity() {
        this(ProcessHandle.current().pid(), resolveHost());
    }

    /**
     * Creates an explicit identity.
     *
     * @param pid process id
     * @param host host name
     */
    public ProcessIdentity(long pid, String host) {
        this.pid = pid;
        this.host = host;
    }

    /**
     * Returns the owner id of this process.
     *
     * @return {@code pid@host}
     */
    public String ownerId() {
        return pid + "@" + host;
    }

    /**
     * Returns whether an owner id names a process on this host.
     *
     * @param ownerId owner id from the ledger
     * @return {@code true} when the host part equals this host
     */
    public boolean isLocal(String ownerId) {
        return host.equals(StringUtils.substringAfter(ownerId, "@"));
    }

    /**
     * Returns whether the local process named by an owner id is still running.
     *
     * @param ownerId owner id on this host
     * @return {@code true} if the process is alive
     */
    public boolean isAlive(String ownerId) {
        String pidPart = StringUtils.substringBefore(ownerId, "@");
        if (!StringUtils.isNumeric(pidPart)) {
            return false;
        }
        long ownerPid = Long.parseLong(pidPart);
        if (ownerPid == pid) {
            return true;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(ownerPid);
        return handle.map(ProcessHandle::isAlive).orElse(false);
    }

    private static String resolveHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name, using 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }
}
