package io.github.yok.chunkload.config;

import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.db.DbDialectHandlerFactory;
import io.github.yok.chunkload.util.ProcessIdentity;
import java.time.Clock;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Infrastructure beans shared by the import components.
 *
 * @author Yasuharu.Okawauchi
 */
@Configuration
public class ChunkLoadBeans {

    /**
     * Clock used for ledger timestamps and durations.
     *
     * @return system clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Identity written to {@code owner_id} when a chunk enters processing.
     *
     * @return identity of this JVM
     */
    @Bean
    public ProcessIdentity processIdentity() {
        return new ProcessIdentity();
    }

    /**
     * Dialect of the destination database, resolved once at startup.
     *
     * @param factory dialect factory
     * @param dataSource destination data source
     * @return dialect handler
     */
    @Bean
    public DbDialectHandler dbDialectHandler(DbDialectHandlerFactory factory,
            DataSource dataSource) {
        return factory.create(dataSource);
    }
}
