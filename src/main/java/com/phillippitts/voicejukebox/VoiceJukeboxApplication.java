package com.phillippitts.voicejukebox;

import com.phillippitts.voicejukebox.config.properties.LibraryBackendProperties;
import com.phillippitts.voicejukebox.config.properties.PopulatorProperties;
import com.phillippitts.voicejukebox.config.properties.QueueProperties;
import com.phillippitts.voicejukebox.config.properties.RankingProperties;
import com.phillippitts.voicejukebox.config.properties.ResolverProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ResolverProperties.class,
        RankingProperties.class,
        QueueProperties.class,
        PopulatorProperties.class,
        LibraryBackendProperties.class
})
@EnableScheduling
public class VoiceJukeboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceJukeboxApplication.class, args);
    }

}
