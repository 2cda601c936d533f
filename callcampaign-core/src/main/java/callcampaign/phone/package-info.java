/**
 * Phone number validation and E.164 normalization.
 *
 * @see callcampaign.phone.PhoneNumberNormalizer
 */
package callcampaign.phone;
