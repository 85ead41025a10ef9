package alertcore.dispatch;

import alertcore.model.Alert;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * SMTP 邮件通道
 */
@Slf4j
public class EmailChannel extends NotificationChannel {
    private final String smtpServer;
    private final int smtpPort;
    private final String fromEmail;
    private final JavaMailSender mailSender;
    private final Clock clock;

    public EmailChannel(Map<String, Object> config, Clock clock) {
        this(config, createSender(config), clock);
    }

    EmailChannel(Map<String, Object> config, JavaMailSender mailSender, Clock clock) {
        super(ChannelType.EMAIL, Boolean.TRUE.equals(config.get("enabled")), castList(config.get("to_emails")));
        this.smtpServer = smtpServer(config);
        this.smtpPort = smtpPort(config);
        this.fromEmail = (String) config.get("from_email");
        this.mailSender = mailSender;
        this.clock = clock;
    }

    private static String smtpServer(Map<String, Object> config) {
        return (String) config.getOrDefault("smtp_server", "smtp.gmail.com");
    }

    private static int smtpPort(Map<String, Object> config) {
        return ((Number) config.getOrDefault("smtp_port", 587)).intValue();
    }

    private static JavaMailSender createSender(Map<String, Object> config) {
        String username = (String) config.get("username");
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(smtpServer(config));
        sender.setPort(smtpPort(config));
        sender.setUsername(username);
        sender.setPassword((String) config.get("password"));
        sender.setDefaultEncoding("UTF-8");
        Properties props = sender.getJavaMailProperties();
        props.put("mail.smtp.auth", String.valueOf(StringUtils.isNotBlank(username)));
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "10000");
        props.put("mail.smtp.writetimeout", "10000");
        return sender;
    }

    @Override
    public void deliver(Alert alert) {
        if (CollectionUtils.isEmpty(recipients)) {
            throw new TransportException("邮件收件人未配置");
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            if (StringUtils.isNotBlank(fromEmail)) {
                helper.setFrom(fromEmail);
            }
            helper.setTo(recipients.toArray(new String[0]));
            helper.setSubject("🚨 Tool Monitor Alert: " + alert.getTitle());
            helper.setText(buildHtml(alert), true);
            mailSender.send(message);
            log.info("邮件告警发送成功: {}", alert.getTitle());
        } catch (MessagingException | MailException e) {
            throw new TransportException("发送邮件告警失败: " + e.getMessage(), e);
        }
    }

    String buildHtml(Alert alert) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body>")
                .append("<h2>🚨 Tool Monitor Alert</h2>")
                .append("<h3>").append(escape(alert.getTitle())).append("</h3>")
                .append("<p><strong>Level:</strong> ").append(alert.getLevel() != null ? alert.getLevel() : "UNKNOWN").append("</p>")
                .append("<p><strong>Time:</strong> ").append(alert.getTimestamp() != null ? alert.getTimestamp() : clock.instant()).append("</p>")
                .append("<p><strong>Source:</strong> ").append(escape(StringUtils.defaultIfBlank(alert.getSource(), "unknown"))).append("</p>")
                .append("<hr>")
                .append("<p>").append(escape(StringUtils.defaultIfBlank(alert.getMessage(), "No message provided"))).append("</p>");
        if (StringUtils.isNotBlank(alert.getDetails())) {
            html.append("<pre>").append(escape(alert.getDetails())).append("</pre>");
        }
        return html.append("</body></html>").toString();
    }

    private static String escape(String text) {
        return text == null ? "" : StringUtils.replaceEach(text,
                new String[]{"&", "<", ">", "\""},
                new String[]{"&amp;", "&lt;", "&gt;", "&quot;"});
    }

    @SuppressWarnings("unchecked")
    private static List<String> castList(Object value) {
        return value instanceof List ? (List<String>) value : null;
    }

    @Override
    public String describe() {
        return "SMTP=" + smtpServer + ":" + smtpPort + ", recipients=" + recipients.size();
    }
}
