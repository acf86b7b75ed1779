package dev.pekelund.invoicebatch;

import org.springframework.modulith.Modulithic;

/**
 * Anchor for the application module model of the invoice batch pipeline. Every direct
 * sub-package is treated as an application module.
 */
@Modulithic(systemName = "invoice-batch")
public final class InvoiceBatchModulithConfiguration {

    private InvoiceBatchModulithConfiguration() {
    }
}
