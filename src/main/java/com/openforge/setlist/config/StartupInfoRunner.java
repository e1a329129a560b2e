package com.openforge.setlist.config;

import com.openforge.setlist.artist.ArtistProperties;
import com.openforge.setlist.auth.JwtProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a startup summary once the context is ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Tokens: issuer and ttls (the secret is never printed)
 *   - Runtime: Java version, server port
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource       dataSource;
    private final JwtProperties    jwtProperties;
    private final ArtistProperties artistProperties;
    private final Environment      env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Setlist  —  Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tokens                                                  ║
                ║    Issuer         : {}
                ║    Access TTL     : {}
                ║    Refresh TTL    : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Artists                                                 ║
                ║    Max picture    : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                checkDatabase(),

                jwtProperties.issuer(),
                jwtProperties.accessTokenTtl(),
                jwtProperties.refreshTokenTtl(),

                artistProperties.profilePictureMaxSize()
        );
    }

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or the failure.
     */
    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String product = conn.getMetaData().getDatabaseProductName();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + product + " " + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            log.warn("[Startup] Database check failed: {}", e.getMessage());
            return "✘ FAILED: " + e.getMessage();
        }
    }
}
