package org.mailpulse.alert.engine.notification.service.notification;

import com.google.common.base.Strings;
import java.time.Instant;
import java.util.List;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.SectionBlock;
import org.mailpulse.alert.engine.notification.transport.webhook.slack.Text;

public interface SlackMessage {

  static SectionBlock getTitleBlock(String titleMessage) {
    return SectionBlock.ofText(Text.markdown(titleMessage));
  }

  static void addIfNotEmpty(List<Text> metadataFields, String value, String type) {
    if (!Strings.isNullOrEmpty(value)) {
      metadataFields.add(Text.field(type, value));
    }
  }

  /** Slack renders the date in the reader's time zone, the ISO string is the fallback. */
  static void addTimestamp(List<Text> metadataFields, String isoTimestamp, String type) {
    if (!Strings.isNullOrEmpty(isoTimestamp)) {
      long epochSeconds = Instant.parse(isoTimestamp).getEpochSecond();
      metadataFields.add(
          Text.field(
              type,
              "<!date^" + epochSeconds + "^{date_num} {time_secs}|" + isoTimestamp + " UTC>"));
    }
  }
}
