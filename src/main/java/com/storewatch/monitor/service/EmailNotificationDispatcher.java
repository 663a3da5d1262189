package com.storewatch.monitor.service;

import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGridAPI;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.storewatch.monitor.model.Alert;
import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.repository.StoreRepository;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * {@link NotificationDispatcher} sending alert e-mails through SendGrid.
 *
 * The recipient is the owner address stored on the store row, read at dispatch time.
 * Stores without an owner address are skipped silently.
 */
@Singleton
public class EmailNotificationDispatcher implements NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationDispatcher.class);

    private final SendGridAPI sendGrid;
    private final StoreRepository storeRepository;
    private final AlertMessageRenderer renderer;
    private final String fromEmail;
    private final String fromName;
    private final boolean enabled;

    @Inject
    public EmailNotificationDispatcher(SendGridAPI sendGrid,
                                       StoreRepository storeRepository,
                                       AlertMessageRenderer renderer,
                                       @Value("${sendgrid.from-email:alerts@storewatch.io}") String fromEmail,
                                       @Value("${sendgrid.from-name:StoreWatch}") String fromName,
                                       @Value("${sendgrid.enabled:true}") boolean enabled) {
        this.sendGrid = sendGrid;
        this.storeRepository = storeRepository;
        this.renderer = renderer;
        this.fromEmail = fromEmail;
        this.fromName = fromName;
        this.enabled = enabled;
    }

    @Override
    public void dispatch(Store store, Alert alert) {
        try {
            Optional<String> recipient = storeRepository.findOwnerEmail(store.getId());
            if (recipient.isEmpty()) {
                log.debug("No owner e-mail, alert not sent storeId={} alertId={}", store.getId(), alert.getId());
                return;
            }

            AlertMessageRenderer.RenderedMessage message = renderer.render(store.getUrl(), alert);

            if (!enabled) {
                log.info("Mail disabled, alert e-mail skipped storeId={} to={} subject={}",
                        store.getId(), recipient.get(), message.subject());
                return;
            }

            Mail mail = new Mail(new Email(fromEmail, fromName), message.subject(),
                    new Email(recipient.get()), new Content("text/html", message.html()));

            Request request = new Request();
            request.setMethod(Method.POST);
            request.setEndpoint("mail/send");
            request.setBody(mail.build());

            Response response = sendGrid.api(request);
            if (response.getStatusCode() >= 200 && response.getStatusCode() < 300) {
                log.info("Alert e-mail sent storeId={} alertId={} category={} to={}",
                        store.getId(), alert.getId(), alert.getCategory(), recipient.get());
            } else {
                log.warn("Alert e-mail rejected storeId={} alertId={} status={} body={}",
                        store.getId(), alert.getId(), response.getStatusCode(), response.getBody());
            }

        } catch (IOException | RuntimeException e) {
            log.warn("Alert e-mail failed storeId={} alertId={}: {}", store.getId(), alert.getId(), e.getMessage());
        }
    }
}
