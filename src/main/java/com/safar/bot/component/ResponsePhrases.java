package com.safar.bot.component;

import org.springframework.stereotype.Component;

/**
 * User-facing text. Kept in one place so flows only decide what to say, not how.
 */
@Component
public class ResponsePhrases {

    public String welcome() {
        return "Assalam o Alaikum! Welcome to Safar Bus Service. How can I help you today?";
    }

    public String rootMenuHint() {
        return "Please pick one of the options below.";
    }

    public String chooseRoute() {
        return "Where would you like to travel? Please choose your route.";
    }

    public String unknownRoute() {
        return "Sorry, I didn't recognise that route. Please choose one from the list.";
    }

    public String noRoutes() {
        return "There are no routes open for booking right now. Please check back later.";
    }

    public String tripUnavailable(String route, String date) {
        return "Sorry, the " + route + " departure on " + date + " is no longer available. Please start a new booking.";
    }

    public String noDates(String route) {
        return "There are no upcoming departures for " + route + " at the moment. Please check back later.";
    }

    public String chooseDate(String route) {
        return "Great, " + route + " it is. Which date would you like to travel?";
    }

    public String unknownDate() {
        return "That date isn't available. Please choose one of the listed dates.";
    }

    public String askName() {
        return "Please enter the passenger's full name.";
    }

    public String invalidName() {
        return "The name should be between 3 and 60 characters. Please enter the full name.";
    }

    public String askRegNumber() {
        return "Please enter your university registration number (e.g. 2021234).";
    }

    public String invalidRegNumber() {
        return "That registration number doesn't look right. It should be 7 digits starting with 20, e.g. 2021234.";
    }

    public String askPhone() {
        return "Please enter a contact phone number (e.g. 03001234567).";
    }

    public String invalidPhone() {
        return "Please enter a valid mobile number in the format 03XXXXXXXXX.";
    }

    public String chooseSeat(int freeCount) {
        return freeCount + " seats are free. Please pick a seat number.";
    }

    public String invalidSeat() {
        return "That seat isn't available. Please pick one of the free seats.";
    }

    public String seatTaken(int seat) {
        return "Sorry, seat " + seat + " was just taken by someone else. Please pick another seat.";
    }

    public String soldOut() {
        return "Sorry, this bus is fully booked. Please try another date.";
    }

    public String confirmSummary(String route, String date, String name, String reg, String phone,
                                 String seat, Integer fare) {
        return "Please confirm your booking:\n"
                + "Route: " + route + "\n"
                + "Date: " + date + "\n"
                + "Name: " + name + "\n"
                + "Reg #: " + reg + "\n"
                + "Phone: " + phone + "\n"
                + "Seat: " + seat + "\n"
                + "Fare: " + (fare != null ? "Rs. " + fare : "TBD");
    }

    public String bookingCreated(String bookingId, String route, String date, int seat) {
        return "Your seat is reserved! Booking ID: " + bookingId + "\n"
                + route + " on " + date + ", seat " + seat + ". Status: pending payment.";
    }

    public String paymentInfo(Integer fare) {
        return "Please pay " + (fare != null ? "Rs. " + fare : "the fare")
                + " and upload a screenshot of the payment to confirm your seat.";
    }

    public String uploadPrompt(String bookingId) {
        return "Upload your payment screenshot for booking " + bookingId + " here:";
    }

    public String bookingCancelled() {
        return "Booking cancelled. Nothing was saved.";
    }

    public String statusMenu() {
        return "What would you like to check?";
    }

    public String busStatusHeader() {
        return "Upcoming departures:";
    }

    public String busStatusEmpty() {
        return "There are no upcoming departures scheduled right now.";
    }

    public String askLookupPhone() {
        return "Please enter the phone number you used for booking.";
    }

    public String noBookingsFound(String phone) {
        return "No bookings found for " + phone + ".";
    }

    public String bookingsHeader(String phone) {
        return "Bookings for " + phone + ":";
    }

    public String faqMenu() {
        return "What would you like to know? Pick a topic or just type your question.";
    }

    public String faqAnythingElse() {
        return "Anything else I can help with?";
    }

    public String faqNoMatch() {
        return "Sorry, I couldn't find an answer to that. Please pick a topic below.";
    }

    public String adminMenu() {
        return "Admin panel. Pick a setting or type a command, e.g. 'fare multan 3800'.";
    }

    public String adminUpdated(String key) {
        return "Updated " + key + ". The FAQ answers have been refreshed.";
    }

    public String adminKbRebuilt(int entries) {
        return "Knowledge base rebuilt with " + entries + " entries.";
    }

    public String adminAuditEmpty() {
        return "The audit log is empty.";
    }

    public String adminUnknownRoute(String route) {
        return "Unknown route '" + route + "'. Add a fare for it first with: fare <route> <amount>";
    }

    public String adminUsage(String usage) {
        return "Usage: " + usage;
    }

    public String tryAgain() {
        return "Something went wrong on our side. Please try again in a moment.";
    }
}
