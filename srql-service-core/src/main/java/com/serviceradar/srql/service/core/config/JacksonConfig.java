package com.serviceradar.srql.service.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Absent cursors and errors are omitted from responses instead of rendered as null. */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor srqlObjectMapperCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
                    om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
                }
                return bean;
            }
        };
    }
}
