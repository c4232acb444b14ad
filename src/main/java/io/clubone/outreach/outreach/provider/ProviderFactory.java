package io.clubone.outreach.outreach.provider;

import io.clubone.outreach.outreach.OutreachProperties;
import org.springframework.stereotype.Component;

@Component
public class ProviderFactory {

	private final OutreachProperties props;
	private final NoopChannelProvider noopChannel;
	private final HttpChannelProvider httpChannel;
	private final NoopTaggingProvider noopTagging;
	private final HttpTaggingProvider httpTagging;

	public ProviderFactory(OutreachProperties props, NoopChannelProvider noopChannel, HttpChannelProvider httpChannel,
			NoopTaggingProvider noopTagging, HttpTaggingProvider httpTagging) {
		this.props = props;
		this.noopChannel = noopChannel;
		this.httpChannel = httpChannel;
		this.noopTagging = noopTagging;
		this.httpTagging = httpTagging;
	}

	public ChannelProvider channel() {
		return isHttp(props.getChannel().getStrategy()) ? httpChannel : noopChannel;
	}

	public TaggingProvider tagging() {
		return isHttp(props.getTagging().getStrategy()) ? httpTagging : noopTagging;
	}

	/**
	 * An HTTP channel without credentials counts as not configured; NOOP is always configured.
	 */
	public boolean isChannelConfigured() {
		if (!isHttp(props.getChannel().getStrategy())) {
			return true;
		}
		String apiKey = props.getChannel().getHttp().getApiKey();
		return apiKey != null && !apiKey.isBlank();
	}

	private static boolean isHttp(String strategy) {
		return "HTTP".equalsIgnoreCase(strategy);
	}
}
