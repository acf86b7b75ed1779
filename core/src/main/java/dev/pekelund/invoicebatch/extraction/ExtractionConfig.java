package dev.pekelund.invoicebatch.extraction;

import dev.pekelund.invoicebatch.upload.InvoiceExtractionService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {

    @Bean
    @ConditionalOnProperty(prefix = "invoice.extraction", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnExpression("'${invoice.extraction.base-url:}' != ''")
    @ConditionalOnMissingBean(InvoiceExtractionService.class)
    public RestInvoiceExtractionClient restInvoiceExtractionClient(ObjectProvider<RestClient.Builder> restClientBuilder,
        ExtractionProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        RestClient restClient = restClientBuilder.getIfAvailable(RestClient::builder)
            .requestFactory(requestFactory)
            .build();
        return new RestInvoiceExtractionClient(restClient, properties);
    }
}
