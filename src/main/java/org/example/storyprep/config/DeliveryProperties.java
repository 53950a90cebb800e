package org.example.storyprep.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "delivery")
public class DeliveryProperties {

    /** Address of the reading device (e.g. a Kindle "send to" address). */
    private String deviceEmail;
    private String fromEmail;
    private String adminEmail;
    /** When set, chunks go to the admin address and subjects get a [TEST] prefix. */
    private boolean testMode = false;
    private boolean scheduleEnabled = true;
    private int claimMinutes = 10;
    private int maxClaimAttempts = 5;
    private String publisher = "Story Prep";

    public String getDeviceEmail() {
        return deviceEmail;
    }

    public void setDeviceEmail(String deviceEmail) {
        this.deviceEmail = deviceEmail;
    }

    public String getFromEmail() {
        return fromEmail;
    }

    public void setFromEmail(String fromEmail) {
        this.fromEmail = fromEmail;
    }

    public String getAdminEmail() {
        return adminEmail;
    }

    public void setAdminEmail(String adminEmail) {
        this.adminEmail = adminEmail;
    }

    public boolean isTestMode() {
        return testMode;
    }

    public void setTestMode(boolean testMode) {
        this.testMode = testMode;
    }

    public boolean isScheduleEnabled() {
        return scheduleEnabled;
    }

    public void setScheduleEnabled(boolean scheduleEnabled) {
        this.scheduleEnabled = scheduleEnabled;
    }

    public int getClaimMinutes() {
        return claimMinutes;
    }

    public void setClaimMinutes(int claimMinutes) {
        this.claimMinutes = claimMinutes;
    }

    public int getMaxClaimAttempts() {
        return maxClaimAttempts;
    }

    public void setMaxClaimAttempts(int maxClaimAttempts) {
        this.maxClaimAttempts = maxClaimAttempts;
    }

    public String getPublisher() {
        return publisher;
    }

    public void setPublisher(String publisher) {
        this.publisher = publisher;
    }

    public boolean hasAdminEmail() {
        return adminEmail != null && !adminEmail.isBlank();
    }

    /**
     * Where chunks actually go: the admin address in test mode (when one is set), else the device.
     */
    public String resolveRecipient() {
        if (testMode && hasAdminEmail()) {
            return adminEmail;
        }
        return deviceEmail;
    }
}
