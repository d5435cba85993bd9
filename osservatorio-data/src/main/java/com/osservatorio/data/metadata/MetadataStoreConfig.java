package com.osservatorio.data.metadata;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class MetadataStoreConfig {

    /**
     * Hashes stored API credentials. Strength is configurable because tests and
     * small deployments do not need the cost of the default.
     */
    @Bean
    public PasswordEncoder credentialEncoder(@Value("${osservatorio.store.credential-hash-strength:10}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }
}
