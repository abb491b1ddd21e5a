package moe.server.infrastructure.mongodb;

import com.mongodb.client.MongoClient;
import java.util.Optional;
import org.springframework.web.util.HtmlUtils;

/** Variant used while the debug toolbar is on. Only adds {@link #render()}. */
public final class DisplayableMongoConnection extends AbstractMongoConnection {

  static final String RENDER_PREFIX = "MongoDB: ";

  DisplayableMongoConnection(MongoClient client, MongoEndpoint endpoint) {
    super(client, endpoint);
  }

  @Override
  public Optional<String> render() {
    return Optional.of(RENDER_PREFIX + "<b>" + HtmlUtils.htmlEscape(toString()) + "</b>");
  }
}
