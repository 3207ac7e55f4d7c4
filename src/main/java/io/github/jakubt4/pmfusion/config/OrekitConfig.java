package io.github.jakubt4.pmfusion.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.data.ZipJarCrawler;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@code orekit-data.zip} with Orekit's default {@link DataContext} when it is on the
 * classpath.
 *
 * <p>Epoch conversion only uses the TT scale, which Orekit defines without external data, so a
 * missing archive is not fatal. UTC-based epochs need the leap-second tables it carries.
 */
@Slf4j
@Configuration
public class OrekitConfig {

    static final String DATA_ARCHIVE = "orekit-data.zip";

    @PostConstruct
    public void init() {
        final var orekitData = OrekitConfig.class.getClassLoader().getResource(DATA_ARCHIVE);
        if (orekitData == null) {
            log.warn("{} not found on classpath, only TT epochs are available", DATA_ARCHIVE);
            return;
        }
        DataContext.getDefault().getDataProvidersManager().addProvider(new ZipJarCrawler(orekitData));
        log.info("Orekit data loaded from classpath:{}", DATA_ARCHIVE);
    }
}
