package de.jwiegmann.chunkupload.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.chunkupload.boundary.admission.AdmissionControl;
import de.jwiegmann.chunkupload.boundary.admission.AdmissionControlInterceptor;
import de.jwiegmann.chunkupload.boundary.admission.FixedWindowAdmissionControl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Slf4j
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    private final UploadProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebConfiguration(UploadProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Bean
    public AdmissionControl admissionControl() {
        UploadProperties.Admission admission = properties.getAdmission();
        if (!admission.isEnabled()) {
            return AdmissionControl.permitAll();
        }
        log.info("Admission control enabled: {} requests per {}", admission.getMaxRequests(), admission.getWindow());
        return new FixedWindowAdmissionControl(admission.getMaxRequests(), admission.getWindow(), clock);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdmissionControlInterceptor(admissionControl(), objectMapper, clock))
                .addPathPatterns("/api/**");
    }
}
