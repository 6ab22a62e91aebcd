package com.phillippitts.enhancer.exception;

import com.phillippitts.enhancer.domain.ChannelLayout;

/**
 * Thrown when a filtering primitive cannot process a buffer's channel layout.
 * The max-quality path reacts by degrading to the smart path.
 */
public class FilterUnavailableException extends ImageEnhancerException {

    private final String filter;
    private final ChannelLayout layout;

    public FilterUnavailableException(String filter, ChannelLayout layout) {
        super("Filter '" + filter + "' cannot process layout " + layout);
        this.filter = filter;
        this.layout = layout;
    }

    public String getFilter() {
        return filter;
    }

    public ChannelLayout getLayout() {
        return layout;
    }

    @Override
    public String stage() {
        return "filter";
    }
}
