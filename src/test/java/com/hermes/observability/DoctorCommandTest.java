package com.hermes.observability;

import com.hermes.containers.ContainerLauncher;
import com.hermes.containers.WarmPool;
import com.hermes.store.InMemoryVersionedStore;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DoctorCommandTest {

    @Test
    void reportsPostgresOkWhenConnectionSucceeds() throws Exception {
        var rs = mock(ResultSet.class);
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);
        var conn = mock(Connection.class);
        when(conn.prepareStatement("SELECT 1")).thenReturn(ps);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);

        var doctor = new DoctorCommand(ds, emptyPool(null));
        var result = doctor.run();

        assertTrue(result.contains("[OK] PostgreSQL connection"));
        assertTrue(result.contains("[OK] Java"));
    }

    @Test
    void reportsPostgresFailWhenConnectionThrows() throws Exception {
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new RuntimeException("refused"));

        var doctor = new DoctorCommand(ds, emptyPool(null));
        var result = doctor.run();

        assertTrue(result.contains("[FAIL] PostgreSQL: refused"));
    }

    @Test
    void reportsInMemoryStoreAndWarmPool() {
        var pool = emptyPool(null);
        pool.register("c1");

        var result = new DoctorCommand(null, pool).run();

        assertTrue(result.contains("[OK] In-memory store"));
        assertTrue(result.contains("[SKIP] No container launcher configured"));
        assertTrue(result.contains("[OK] 1 warm containers"));
    }

    @Test
    void reportsUnavailableLauncherAndEmptyPool() {
        var launcher = mock(ContainerLauncher.class);
        when(launcher.isAvailable()).thenReturn(false);

        var result = new DoctorCommand(null, emptyPool(launcher)).run();

        assertTrue(result.contains("[FAIL] Container launcher unavailable"));
        assertTrue(result.contains("[WARN] No warm containers"));
    }

    private static WarmPool emptyPool(ContainerLauncher launcher) {
        return new WarmPool(new InMemoryVersionedStore<>(), launcher, Clock.systemUTC());
    }
}
