package com.delta.pagetracker.crawl.auth;

public record LoginDetection(
    boolean loginPage,
    LoginMethod loginMethod,
    SuggestedFields suggestedFields,
    String error
) {
    public static LoginDetection notLoginPage() {
        return new LoginDetection(false, null, SuggestedFields.none(), null);
    }

    public boolean canSubmitForm() {
        return loginPage
            && loginMethod == LoginMethod.FORM
            && suggestedFields.usernameSelector() != null
            && suggestedFields.passwordSelector() != null;
    }

    public record SuggestedFields(
        String usernameSelector,
        String passwordSelector,
        String submitSelector,
        String formSelector
    ) {
        public static SuggestedFields none() {
            return new SuggestedFields(null, null, null, null);
        }
    }
}
