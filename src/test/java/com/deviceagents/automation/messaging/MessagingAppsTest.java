package com.deviceagents.automation.messaging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MessagingAppsTest {

    @Test
    public void testWhatsAppAliases() {
        assertEquals(MessagingApps.WHATSAPP, MessagingApps.normalize("WhatsApp"));
        assertEquals(MessagingApps.WHATSAPP, MessagingApps.normalize("what'sapp"));
        assertEquals(MessagingApps.WHATSAPP_BUSINESS, MessagingApps.normalize("WhatsApp Bussiness"));
        assertEquals(MessagingApps.WHATSAPP_BUSINESS, MessagingApps.normalize("whatsapp_w4b"));
        assertEquals(MessagingApps.WHATSAPP_PERSONAL, MessagingApps.normalize("whatsapp personal"));
    }

    @Test
    public void testOtherApps() {
        assertEquals(MessagingApps.INSTAGRAM, MessagingApps.normalize("Insta"));
        assertEquals(MessagingApps.MESSENGER, MessagingApps.normalize("FB Messenger"));
        assertEquals(MessagingApps.GOOGLE_MESSAGES, MessagingApps.normalize("SMS"));
        assertNull(MessagingApps.normalize("telegram"));
        assertNull(MessagingApps.normalize("  "));
    }

    @Test
    public void testIsWhatsApp() {
        assertTrue(MessagingApps.isWhatsApp(MessagingApps.WHATSAPP_BUSINESS));
        assertFalse(MessagingApps.isWhatsApp(MessagingApps.INSTAGRAM));
    }

    @Test
    public void testVariantFromLooseType() {
        assertEquals(WhatsAppVariant.BUSINESS, WhatsAppVariant.fromType("Business"));
        assertEquals(WhatsAppVariant.BUSINESS, WhatsAppVariant.fromType("biz"));
        assertEquals(WhatsAppVariant.PERSONAL, WhatsAppVariant.fromType("normal"));
        assertNull(WhatsAppVariant.fromType("enterprise"));
        assertEquals(WhatsAppVariant.BUSINESS, WhatsAppVariant.fromPackage("com.whatsapp.w4b"));
        assertNull(WhatsAppVariant.fromPackage("org.telegram.messenger"));
    }
}
