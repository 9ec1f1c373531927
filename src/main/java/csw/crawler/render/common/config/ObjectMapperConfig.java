package csw.crawler.render.common.config;


import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.util.StdDateFormat;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.blackbird.BlackbirdModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

@Configuration
public class ObjectMapperConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(new Jdk8Module())
                .addModule(new ParameterNamesModule())// Record constructors
                .addModule(new BlackbirdModule())

                // Mapper features
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS) // load states: "networkidle", "NETWORKIDLE"

                // Parser features
                .enable(JsonParser.Feature.ALLOW_COMMENTS)
                .disable(JsonParser.Feature.AUTO_CLOSE_SOURCE)

                // Serialization features
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)

                // Deserialization features
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)

                // Wait conditions are typed through @JsonTypeInfo only, never through default typing
                .deactivateDefaultTyping()

                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)

                // Include only non-null and non-absent values
                .serializationInclusion(JsonInclude.Include.NON_ABSENT)

                .defaultDateFormat(new StdDateFormat()
                        .withColonInTimeZone(true)
                        .withTimeZone(TimeZone.getTimeZone("UTC"))
                )
                .build();
    }
}
