package com.flagship.collective_finance.processor;

/**
 * Raised by an {@link ExternalProcessorClient} when the processor declines
 * a call.
 */
public class ProcessorRejectedException extends RuntimeException {

    public ProcessorRejectedException(String message) {
        super(message);
    }
}
