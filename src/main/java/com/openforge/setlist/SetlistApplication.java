package com.openforge.setlist;

import com.openforge.setlist.artist.ArtistProperties;
import com.openforge.setlist.auth.JwtProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({JwtProperties.class, ArtistProperties.class})
public class SetlistApplication {

    public static void main(String[] args) {
        SpringApplication.run(SetlistApplication.class, args);
    }
}
