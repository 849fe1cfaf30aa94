package com.hagglehub.ingest;

import com.hagglehub.shared.model.InboundMessage;
import com.hagglehub.shared.model.RecipientIdentity;

import java.util.regex.Pattern;

/**
 * Derives the routing token from a recipient local part. A local part without the
 * alias prefix is used verbatim as its own token.
 */
public class IdentityExtractor {

    private final Pattern aliasPrefix;

    public IdentityExtractor(String aliasPrefix) {
        this.aliasPrefix = Pattern.compile("^(?:" + aliasPrefix + ")", Pattern.CASE_INSENSITIVE);
    }

    public String token(String localPart) {
        if (localPart == null) return "";
        var m = aliasPrefix.matcher(localPart);
        if (m.find()) {
            return localPart.substring(m.end());
        }
        return localPart;
    }

    public RecipientIdentity identify(String recipient) {
        var address = EmailAddresses.firstAddress(recipient);
        if (address.indexOf('@') < 0) {
            return RecipientIdentity.empty();
        }
        var localPart = EmailAddresses.localPart(address);
        return new RecipientIdentity(token(localPart), localPart, EmailAddresses.domain(address));
    }

    /** Uses the address parts the normalizer already split off. */
    public RecipientIdentity identify(InboundMessage message) {
        if (message.recipientLocalPart().isEmpty()) {
            return new RecipientIdentity("", "", message.recipientDomain());
        }
        return new RecipientIdentity(token(message.recipientLocalPart()),
                message.recipientLocalPart(), message.recipientDomain());
    }
}
