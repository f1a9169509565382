package com.hermes.observability;

import com.hermes.containers.WarmPool;

import javax.sql.DataSource;
import java.util.ArrayList;

public class DoctorCommand {

    private final DataSource dataSource;
    private final WarmPool pool;

    /** {@code dataSource} is null when running on the in-memory store. */
    public DoctorCommand(DataSource dataSource, WarmPool pool) {
        this.dataSource = dataSource;
        this.pool = pool;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkStore());
        results.add(checkLauncher());
        results.add(checkWarmPool());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkStore() {
        if (dataSource == null) return "[OK] In-memory store (state is lost on restart)";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT 1");
             var rs = ps.executeQuery()) {
            return "[OK] PostgreSQL connection";
        } catch (Exception e) {
            return "[FAIL] PostgreSQL: " + e.getMessage();
        }
    }

    private String checkLauncher() {
        var launcher = pool.launcher();
        if (launcher == null) return "[SKIP] No container launcher configured";
        return launcher.isAvailable()
                ? "[OK] Container launcher available"
                : "[FAIL] Container launcher unavailable";
    }

    private String checkWarmPool() {
        try {
            var warm = pool.warmCount();
            return warm > 0
                    ? "[OK] " + warm + " warm containers"
                    : "[WARN] No warm containers; claims will fail until one registers";
        } catch (RuntimeException e) {
            return "[FAIL] Warm pool: " + e.getMessage();
        }
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
