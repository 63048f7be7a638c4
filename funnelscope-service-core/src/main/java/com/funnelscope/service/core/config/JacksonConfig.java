package com.funnelscope.service.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Funnel results leave statistics {@code null} when there is nothing to report; omit them on the wire. */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor funnelResultNullOmittingCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    customize(om);
                }
                return bean;
            }
        };
    }

    public static ObjectMapper customize(ObjectMapper om) {
        om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        om.configure(SerializationFeature.WRITE_NULL_MAP_VALUES, false);
        return om;
    }
}
