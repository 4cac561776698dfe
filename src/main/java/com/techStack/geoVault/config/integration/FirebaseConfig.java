package com.techStack.geoVault.config.integration;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Firebase Configuration
 *
 * Configures the Firebase App and Firestore, and provides the Clock bean every
 * time-dependent component is driven by.
 */
@Configuration
@Slf4j
public class FirebaseConfig {

    /* =========================
       Configuration Properties
       ========================= */

    @Value("${firebase.service-account.path}")
    private String serviceAccountPath;

    @Value("${firebase.project-id}")
    private String projectId;

    /* =========================
       Clock Configuration
       ========================= */

    @Bean
    @Primary
    public Clock clock() {
        Clock systemClock = Clock.systemUTC();
        log.info("System Clock initialized at {}", systemClock.instant());
        return systemClock;
    }

    /* =========================
       Firebase App Configuration
       ========================= */

    @Bean
    public FirebaseApp firebaseApp(Clock clock, ResourceLoader resourceLoader) {
        Instant startTime = clock.instant();

        if (!FirebaseApp.getApps().isEmpty()) {
            log.info("Using existing Firebase application instance");
            return FirebaseApp.getInstance();
        }

        Resource resource = resourceLoader.getResource(serviceAccountPath);
        if (!resource.exists()) {
            throw new IllegalStateException("Firebase service account not found: " + serviceAccountPath);
        }

        try (InputStream serviceAccount = resource.getInputStream()) {
            FirebaseOptions options = FirebaseOptions.builder()
                    .setCredentials(GoogleCredentials.fromStream(serviceAccount))
                    .setProjectId(projectId)
                    .build();

            FirebaseApp app = FirebaseApp.initializeApp(options);
            log.info("Firebase application initialized for project {} (duration: {})",
                    projectId, Duration.between(startTime, clock.instant()));
            return app;

        } catch (IOException e) {
            log.error("Firebase initialization failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to initialize Firebase", e);
        }
    }

    @Primary
    @Bean
    public Firestore firestore(FirebaseApp firebaseApp) {
        Firestore firestore = FirestoreClient.getFirestore(firebaseApp);
        log.info("Firestore initialized for project {}", projectId);
        return firestore;
    }
}
