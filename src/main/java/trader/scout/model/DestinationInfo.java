package trader.scout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity of the bot and the chat alerts are delivered to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DestinationInfo {
    private String botName;
    private String botUsername;
    private String chatId;
    private String chatType;
    private String chatTitle;
}
